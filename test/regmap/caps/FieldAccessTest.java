package regmap.caps;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

class FieldAccessTest {

  private static AccessCapabilities noOp(NoOpMethod method) { return AccessCapabilities.builder().setNoOpMethod(method).build(); }

  @Test
  void testMaskingStrategy() {
    AccessCapabilities read = AccessCapabilities.builder().build();
    Assertions.assertEquals(FieldAccess.MaskingStrategy.NONE, new FieldAccess(read, null).chooseMasking());
    Assertions.assertEquals(FieldAccess.MaskingStrategy.NONE, new FieldAccess(read, noOp(NoOpMethod.ALWAYS)).chooseMasking());
    Assertions.assertEquals(FieldAccess.MaskingStrategy.STROBE, new FieldAccess(read, noOp(NoOpMethod.WRITE_CURRENT_OR_MASK)).chooseMasking());
    Assertions.assertEquals(FieldAccess.MaskingStrategy.STROBE, new FieldAccess(null, noOp(NoOpMethod.MASK)).chooseMasking());
    // strobe masking is preferred over writing zero
    FieldAccess writeZero = new FieldAccess(null, noOp(NoOpMethod.WRITE_ZERO));
    Assertions.assertTrue(writeZero.canMaskWithZero());
    Assertions.assertEquals(FieldAccess.MaskingStrategy.STROBE, writeZero.chooseMasking());
    Assertions.assertEquals(FieldAccess.MaskingStrategy.RMW, new FieldAccess(read, noOp(NoOpMethod.WRITE_CURRENT)).chooseMasking());
    Assertions.assertNull(new FieldAccess(null, noOp(NoOpMethod.WRITE_CURRENT)).chooseMasking());
    Assertions.assertNull(new FieldAccess(read, noOp(NoOpMethod.NEVER)).chooseMasking());
  }

  @Test
  void testCheckMaskable() throws RegmapException {
    new FieldAccess(AccessCapabilities.builder().build(), noOp(NoOpMethod.WRITE_CURRENT)).checkMaskable("ok");
    RegmapException e = Assertions.assertThrows(
        RegmapException.class, () -> new FieldAccess(null, noOp(NoOpMethod.WRITE_CURRENT)).checkMaskable("wo"));
    Assertions.assertEquals(DiagnosticCategory.MASKING_INFEASIBLE, e.getCategory());
    Assertions.assertEquals("field `wo` with write no-op method WRITE_CURRENT cannot be left untouched by writes: the field is not readable",
                            e.getDiagnostic().message());

    AccessCapabilities sideEffects = AccessCapabilities.builder().setCanReadForRmw(false).build();
    e = Assertions.assertThrows(RegmapException.class,
                                () -> new FieldAccess(sideEffects, noOp(NoOpMethod.WRITE_CURRENT)).checkMaskable("rc"));
    Assertions.assertTrue(e.getDiagnostic().message().endsWith("it cannot be read for read-modify-write"));
  }

  @Test
  void testInvalid() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new FieldAccess(null, null));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new FieldAccess(noOp(NoOpMethod.MASK), null));
  }
}
