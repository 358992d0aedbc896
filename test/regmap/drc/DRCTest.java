package regmap.drc;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import regmap.config.ControlConfig;
import regmap.config.FieldConfig;
import regmap.config.PermissionConfig;
import regmap.config.RegisterFileConfig;
import regmap.config.StatusConfig;
import regmap.model.RegisterFile;
import regmap.model.RegisterFileBuilder;

class DRCTest {

  private static RegisterFile compile(FieldConfig.Builder... fields) throws RegmapException {
    RegisterFileConfig.Builder config = RegisterFileConfig.builder("rf");
    for (FieldConfig.Builder field : fields)
      config.addField(field.build());
    return new RegisterFileBuilder().build(config.build());
  }

  private static DRC check(RegisterFile rf, boolean strict) {
    DRC drc = new DRC(rf);
    drc.SetErrLevel(strict);
    drc.CheckAll();
    return drc;
  }

  @Test
  void testClean() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("a", 0, new ControlConfig()), FieldConfig.builder("b", 4, new StatusConfig()).setBitrange(63, 0));
    Assertions.assertFalse(check(rf, true).HasFatalError());
  }

  @Test
  void testDuplicateRegisterName() throws RegmapException {
    RegisterFile rf =
        compile(FieldConfig.builder("a", 0, new StatusConfig()).setRegisterName("r"), FieldConfig.builder("b", 4, new StatusConfig()).setRegisterName("r"));
    Assertions.assertFalse(check(rf, false).HasFatalError());
    Assertions.assertTrue(check(rf, true).HasFatalError());
  }

  @Test
  void testEmptyWord() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("hi", 0, new StatusConfig()).setBitrange(63, 32));
    DRC drc = new DRC(rf);
    drc.SetErrLevel(true);
    drc.CheckEmptyBlocks();
    Assertions.assertTrue(drc.HasFatalError());
  }

  @Test
  void testMixedPermissions() throws RegmapException {
    RegisterFile rf = compile(
        FieldConfig.builder("a", 0, new StatusConfig()).setBitrange(7, 0).setPermissions(new PermissionConfig(false, true, true, true, true, true)),
        FieldConfig.builder("b", 0, new StatusConfig()).setBitrange(15, 8));
    DRC drc = new DRC(rf);
    drc.CheckProtectedRegisters();
    Assertions.assertFalse(drc.HasFatalError());
    drc.SetErrLevel(true);
    drc.CheckProtectedRegisters();
    Assertions.assertTrue(drc.HasFatalError());
  }

  @Test
  void testMirroredRegister() throws RegmapException {
    RegisterFile rf = compile(FieldConfig.builder("m", "0x1-", new StatusConfig()));
    DRC drc = new DRC(rf);
    drc.SetErrLevel(true);
    drc.CheckAddressMasks();
    Assertions.assertTrue(drc.HasFatalError());

    drc = new DRC(compile(FieldConfig.builder("m", "0x10", new StatusConfig())));
    drc.SetErrLevel(true);
    drc.CheckAddressMasks();
    Assertions.assertFalse(drc.HasFatalError());
  }
}
