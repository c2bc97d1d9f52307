package pgrepl.status;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionInfoTest {

  @Test
  void masksPlainPassword() {
    SubscriptionInfo info = new SubscriptionInfo("sub", true, "host=h dbname=d password=s3cret sslmode=require");

    assertEquals("host=h dbname=d password=**** sslmode=require", info.connInfo());
  }

  @Test
  void masksQuotedPassword() {
    assertEquals("host=h password=**** user=u",
        SubscriptionInfo.maskPassword("host=h password='a b\\'c' user=u"));
  }

  @Test
  void leavesOtherConnInfoAlone() {
    assertEquals("host=h user=u", SubscriptionInfo.maskPassword("host=h user=u"));
    assertNull(SubscriptionInfo.maskPassword(null));
  }
}
