package pgrepl.status;

/**
 * Per-relation progress of a subscription, folded from PostgreSQL's {@code srsubstate} codes.
 */
public enum SyncState {
  INIT,
  DATA_SYNC,
  SYNCED,
  ERROR;

  /**
   * Maps a {@code pg_subscription_rel.srsubstate} code. Unknown codes map to {@link #ERROR}.
   */
  public static SyncState fromCode(String code) {
    if (code == null || code.length() != 1) {
      return ERROR;
    }
    switch (code.charAt(0)) {
      case 'i':
        return INIT;
      case 'd':
      case 'f':
        return DATA_SYNC;
      case 's':
      case 'r':
        return SYNCED;
      default:
        return ERROR;
    }
  }
}
