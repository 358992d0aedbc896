package regmap.caps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

class AccessCapabilitiesTest {
  private static final AccessCapabilities PLAIN = AccessCapabilities.builder().build();
  private static final AccessCapabilities VOLATILE = AccessCapabilities.builder().setVolatile(true).build();
  private static final AccessCapabilities BLOCKING = AccessCapabilities.builder().setVolatile(true).setCanBlock(true).build();
  private static final AccessCapabilities DEFERRING =
      AccessCapabilities.builder().setVolatile(true).setCanBlock(true).setCanDefer(true).setNoOpMethod(NoOpMethod.NEVER).build();

  private static AccessCapabilities.Sibling sibling(String name, AccessCapabilities caps) {
    return new AccessCapabilities.Sibling(name, caps);
  }

  @Test
  void testTwoBlocking() {
    RegmapException e = Assertions.assertThrows(
        RegmapException.class, () -> AccessCapabilities.checkSiblings(List.of(sibling("b", BLOCKING), sibling("a", BLOCKING))));
    Assertions.assertEquals(DiagnosticCategory.SIBLING_CAPABILITY_CONFLICT, e.getCategory());
    Assertions.assertEquals("cannot have more than one blocking field in a single register (`a` and `b`)", e.getDiagnostic().message());
    Assertions.assertEquals(List.of("a", "b"), e.getDiagnostic().owners());
  }

  @Test
  void testBlockingWithPlain() throws RegmapException {
    AccessCapabilities combined = AccessCapabilities.checkSiblings(List.of(sibling("a", BLOCKING), sibling("b", PLAIN)));
    Assertions.assertTrue(combined.canBlock());
    Assertions.assertTrue(combined.isVolatile());
    Assertions.assertFalse(combined.canDefer());
    Assertions.assertEquals(Permissions.ALL, combined.getPermissions());
  }

  @Test
  void testBlockingWithVolatile() {
    RegmapException e = Assertions.assertThrows(
        RegmapException.class, () -> AccessCapabilities.checkSiblings(List.of(sibling("v", VOLATILE), sibling("b", BLOCKING))));
    Assertions.assertEquals("cannot have both volatile fields (`v`) and blocking fields (`b`) in a single register",
                            e.getDiagnostic().message());
  }

  @Test
  void testDeferring() throws RegmapException {
    Assertions.assertTrue(AccessCapabilities.checkSiblings(List.of(sibling("d", DEFERRING))).canDefer());
    RegmapException e = Assertions.assertThrows(
        RegmapException.class, () -> AccessCapabilities.checkSiblings(List.of(sibling("x", PLAIN), sibling("d", DEFERRING))));
    Assertions.assertEquals("fields that can defer cannot be combined with other fields (`d` with `x`)", e.getDiagnostic().message());
  }

  @Test
  void testCombination() throws RegmapException {
    AccessCapabilities zero = AccessCapabilities.builder().setNoOpMethod(NoOpMethod.WRITE_ZERO).build();
    AccessCapabilities mask = AccessCapabilities.builder().setNoOpMethod(NoOpMethod.MASK).setCanReadForRmw(false).build();
    AccessCapabilities combined = AccessCapabilities.checkSiblings(List.of(sibling("a", zero), sibling("b", mask), sibling("c", VOLATILE)));
    Assertions.assertEquals(NoOpMethod.MASK, combined.getNoOpMethod());
    Assertions.assertFalse(combined.canReadForRmw());
    Assertions.assertTrue(combined.isVolatile());
    Assertions.assertFalse(combined.canBlock());

    Assertions.assertEquals(PLAIN, AccessCapabilities.checkSiblings(List.of(sibling("a", PLAIN))));
    Assertions.assertThrows(IllegalArgumentException.class, () -> AccessCapabilities.checkSiblings(List.of()));
  }

  @RepeatedTest(64)
  void testOrderIndependence() {
    long seed = new Random().nextLong();
    try {
      testOrderIndependence(seed);
    } catch (Throwable t) {
      System.err.println("FAILED testOrderIndependence with seed " + seed);
      throw t;
    }
  }

  private static String verdict(List<AccessCapabilities.Sibling> siblings) {
    try {
      return AccessCapabilities.checkSiblings(siblings).toString();
    } catch (RegmapException e) {
      return e.getDiagnostic().message() + " " + e.getDiagnostic().owners();
    }
  }

  void testOrderIndependence(long seed) {
    Random rand = new Random(seed);
    AccessCapabilities[] pool = {PLAIN, VOLATILE, BLOCKING, DEFERRING,
                                 AccessCapabilities.builder().setNoOpMethod(NoOpMethod.WRITE_CURRENT).build()};
    List<AccessCapabilities.Sibling> siblings = new ArrayList<>();
    int count = 1 + rand.nextInt(4);
    for (int i = 0; i < count; ++i)
      siblings.add(sibling("f" + i, pool[rand.nextInt(pool.length)]));
    String expected = verdict(siblings);
    for (int i = 0; i < 8; ++i) {
      Collections.shuffle(siblings, rand);
      Assertions.assertEquals(expected, verdict(siblings));
    }
  }
}
