package regmap.drc;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regmap.address.MaskedAddress;
import regmap.caps.Permissions;
import regmap.model.Field;
import regmap.model.Register;
import regmap.model.RegisterFile;

/**
 * Design rule checks on a compiled register file. Findings that do not break the generated logic are warnings, unless
 * the error level is high.
 */
public class DRC {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private boolean errLevelHigh = false;
  private boolean hasFatalError = false;

  private final RegisterFile registerFile;

  public DRC(RegisterFile registerFile) { this.registerFile = registerFile; }

  public void SetErrLevel(boolean errLevelHigh) { this.errLevelHigh = errLevelHigh; }

  public boolean HasFatalError() { return hasFatalError; }

  /** Runs all checks. */
  public void CheckAll() {
    CheckDuplicateNames();
    CheckEmptyBlocks();
    CheckProtectedRegisters();
    CheckAddressMasks();
  }

  /** Register names end up in the generated selects and should be unique. Field names are unique after building. */
  public void CheckDuplicateNames() {
    Map<String, Register> registerNames = new HashMap<>();
    for (Register register : registerFile.getRegisters()) {
      Register other = registerNames.putIfAbsent(register.getName(), register);
      if (other != null)
        violation("Register name `" + register.getName() + "` is used at both " + other.getAddress().toDocString() + " and " +
                  register.getAddress().toDocString());
    }
  }

  /** Words of multi-word registers that hold no field bits still occupy address space. */
  public void CheckEmptyBlocks() {
    int busWidth = registerFile.getBusWidth();
    for (Register register : registerFile.getRegisters()) {
      for (int index = 0; index < register.getWordCount(); ++index) {
        int low = register.getWordBitOffset(index);
        int high = low + busWidth - 1;
        boolean used = false;
        for (Field field : register.getFields())
          if (field.getLowBit() <= high && field.getHighBit() >= low)
            used = true;
        if (!used)
          violation("Word " + index + " of " + register + " does not contain any field");
      }
    }
  }

  /** Fields with restricted permissions are invisible to some accesses; sharing a register with unrestricted ones is suspicious. */
  public void CheckProtectedRegisters() {
    for (Register register : registerFile.getRegisters()) {
      List<Field> fields = register.getFields();
      Set<Permissions> seen = new HashSet<>();
      for (Field field : fields) {
        seen.add(field.getPermissions());
        if (field.getPermissions().isProtected())
          logger.debug("Field `{}` is restricted to {}", field.getName(), field.getPermissions());
      }
      if (seen.size() > 1)
        violation(register + " mixes fields with different permissions " + seen + "; accesses see only part of the register");
    }
  }

  /** A register address that ignores bits above the word offset is mirrored across the address space. */
  public void CheckAddressMasks() {
    long wordMask = registerFile.getWordBytes() - 1;
    for (Register register : registerFile.getRegisters()) {
      MaskedAddress address = register.getAddress();
      long ignored = address.getIgnored() & ~wordMask;
      if (ignored != 0)
        violation(String.format("%s ignores address bits 0x%X and is mirrored %d times", register, ignored, 1L << Long.bitCount(ignored)));
    }
  }

  private void violation(String message) {
    if (errLevelHigh) {
      logger.fatal(message);
      hasFatalError = true;
    } else
      logger.warn(message);
  }
}
