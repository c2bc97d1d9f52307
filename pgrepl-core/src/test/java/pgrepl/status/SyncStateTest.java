package pgrepl.status;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SyncStateTest {

  @Test
  void mapsPostgresCodes() {
    assertEquals(SyncState.INIT, SyncState.fromCode("i"));
    assertEquals(SyncState.DATA_SYNC, SyncState.fromCode("d"));
    assertEquals(SyncState.DATA_SYNC, SyncState.fromCode("f"));
    assertEquals(SyncState.SYNCED, SyncState.fromCode("s"));
    assertEquals(SyncState.SYNCED, SyncState.fromCode("r"));
  }

  @Test
  void unknownCodesAreErrors() {
    assertEquals(SyncState.ERROR, SyncState.fromCode("x"));
    assertEquals(SyncState.ERROR, SyncState.fromCode(""));
    assertEquals(SyncState.ERROR, SyncState.fromCode(null));
  }
}
