package regmap.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import regmap.address.AddressParser;
import regmap.address.AddressSpace;
import regmap.address.Direction;
import regmap.address.MaskedAddress;
import regmap.behavior.BehaviorRegistry;
import regmap.behavior.FieldBehavior;
import regmap.caps.AccessCapabilities;
import regmap.caps.FieldAccess;
import regmap.caps.Permissions;
import regmap.config.FieldConfig;
import regmap.config.RegisterFileConfig;
import regmap.drc.Diagnostic;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;

/**
 * Compiles a register file description into a {@link RegisterFile}: expands repetition, creates the behaviors, groups
 * fields into registers, checks which fields may share a register and claims the blocks in the address spaces.
 */
public class RegisterFileBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Maximum number of bus words in one register; blocks are suffixed _a to _z. */
  public static final int MAX_WORDS = 26;

  private final BehaviorRegistry registry;

  /** A field instance together with the register name it asked for. */
  private record Placed(Field field, String registerName) {}

  public RegisterFileBuilder(BehaviorRegistry registry) { this.registry = registry; }

  public RegisterFileBuilder() { this(BehaviorRegistry.standard()); }

  public RegisterFile build(RegisterFileConfig config) throws RegmapException {
    int busWidth = config.busWidth();
    int wordBytes = busWidth / 8;
    AddressParser parser = new AddressParser(Integer.numberOfTrailingZeros(wordBytes), MaskedAddress.DEFAULT_WIDTH);

    // expand repetition and group by base address
    Map<MaskedAddress, List<Placed>> groups = new LinkedHashMap<>();
    Set<String> fieldNames = new LinkedHashSet<>();
    for (FieldConfig fieldConfig : config.fields()) {
      for (Placed placed : expand(fieldConfig, parser, busWidth)) {
        String name = placed.field().getName();
        if (!fieldNames.add(name))
          throw new RegmapException(new Diagnostic(DiagnosticCategory.CONFIGURATION, "field name `" + name + "` is used more than once",
                                                   List.of(name), List.of(placed.field().getAddress()), null));
        groups.computeIfAbsent(placed.field().getAddress(), address -> new ArrayList<>()).add(placed);
      }
    }

    AddressSpace<Block> readSpace = new AddressSpace<>(Direction.READ, MaskedAddress.DEFAULT_WIDTH);
    AddressSpace<Block> writeSpace = new AddressSpace<>(Direction.WRITE, MaskedAddress.DEFAULT_WIDTH);
    DeferTagAllocator readTags = new DeferTagAllocator(Direction.READ);
    DeferTagAllocator writeTags = new DeferTagAllocator(Direction.WRITE);

    List<Register> registers = new ArrayList<>();
    for (Map.Entry<MaskedAddress, List<Placed>> group : groups.entrySet()) {
      Register register = buildRegister(group.getKey(), group.getValue(), config, busWidth);
      for (Direction direction : Direction.values()) {
        if (!register.supports(direction))
          continue;
        AddressSpace<Block> space = direction == Direction.READ ? readSpace : writeSpace;
        List<Block> blocks = new ArrayList<>();
        for (int index = 0; index < register.getWordCount(); ++index) {
          MaskedAddress address = register.getAddress().add(index);
          String name = blockName(register.getName(), index, register.getWordCount(), register.getEndianness());
          Block block = new Block(register, direction, index, address, name, ownerOf(register, name));
          space.claim(address, block.getOwner(), block);
          blocks.add(block);
        }
        register.setBlocks(direction, blocks);
        if (register.isDeferring(direction)) {
          Block tagged = direction == Direction.READ ? blocks.get(0) : blocks.get(blocks.size() - 1);
          tagged.deferTag = (direction == Direction.READ ? readTags : writeTags).allocate(tagged.getName());
        }
      }
      logger.debug("Compiled {} with {} word(s) and {} field(s)", register, register.getWordCount(), register.getFields().size());
      registers.add(register);
    }
    readSpace.freeze();
    writeSpace.freeze();
    logger.debug("Register file {}: {} register(s), {} read and {} write block(s)", config.name(), registers.size(),
                 readSpace.getClaims().size(), writeSpace.getClaims().size());
    return new RegisterFile(config.name(), busWidth, registers, readSpace, writeSpace, readTags, writeTags);
  }

  /** Expands one field entry into its instances. */
  private List<Placed> expand(FieldConfig config, AddressParser parser, int busWidth) throws RegmapException {
    String context = "field `" + config.name() + "`";
    MaskedAddress base;
    try {
      base = parser.parse(config.address());
    } catch (RegmapException e) {
      throw new RegmapException(e.getDiagnostic().withOwner(config.name(), context));
    }
    int high = config.hasBitrange() ? config.highBit() : busWidth - 1;
    int low = config.hasBitrange() ? config.lowBit() : 0;
    int width = high - low + 1;
    if (width > 64)
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, context + " is " + width + " bits wide, at most 64 are supported");

    int repeat = config.repeat();
    int fieldRepeat = config.fieldRepeat() != null ? config.fieldRepeat() : repeat;
    int fieldStride = config.fieldStride() != null ? config.fieldStride() : width;
    if (Math.abs(fieldStride) < width)
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, context + ": field-stride is smaller than the width of a single field");

    // bit positions of the fields within one register
    int maxBit = MAX_WORDS * busWidth;
    int[] shifts = new int[Math.min(fieldRepeat, repeat)];
    int registerHigh = 0;
    for (int f = 0; f < shifts.length; ++f) {
      shifts[f] = f * fieldStride;
      if (low + shifts[f] < 0)
        throw arithmeticError(context, base, "underflow during bitrange shift");
      if (high + shifts[f] >= maxBit)
        throw arithmeticError(context, base, "overflow during bitrange shift");
      registerHigh = Math.max(registerHigh, high + shifts[f]);
    }

    int wordBytes = busWidth / 8;
    long registerBytes = (long)(registerHigh / busWidth + 1) * wordBytes;
    long stride = config.stride() != null ? config.stride() : registerBytes;
    boolean multipleRegisters = repeat > fieldRepeat;
    if (multipleRegisters) {
      if (Math.abs(stride) < registerBytes)
        throw new RegmapException(DiagnosticCategory.CONFIGURATION, context + ": stride is smaller than the block size");
      if (stride % wordBytes != 0)
        throw new RegmapException(DiagnosticCategory.CONFIGURATION, context + ": stride is not aligned to the block size");
    }

    List<Placed> ret = new ArrayList<>();
    for (int i = 0; i < repeat; ++i) {
      int registerIndex = i / fieldRepeat;
      String name = repeat > 1 ? config.name() + i : config.name();
      MaskedAddress address;
      try {
        address = base.add(registerIndex * (stride / wordBytes));
      } catch (RegmapException e) {
        throw new RegmapException(e.getDiagnostic().withOwner(name, "field `" + name + "`"));
      }
      String registerName = config.registerName();
      if (registerName != null && multipleRegisters)
        registerName += registerIndex;
      Field field = createField(config, name, i, address, low + shifts[i % fieldRepeat], width);
      ret.add(new Placed(field, registerName));
    }
    return ret;
  }

  private Field createField(FieldConfig config, String name, int index, MaskedAddress address, int lowBit, int width)
      throws RegmapException {
    String context = "field `" + name + "`";
    FieldBehavior behavior;
    Permissions permissions;
    try {
      behavior = registry.create(config.behavior(), width);
      permissions = config.permissions().toPermissions();
    } catch (RegmapException e) {
      throw new RegmapException(e.getDiagnostic().withOwner(name, context));
    }
    AccessCapabilities read = behavior.getReadCapabilities();
    AccessCapabilities write = behavior.getWriteCapabilities();
    if (read == null && write == null)
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, context + " supports neither reads nor writes");
    FieldAccess access;
    try {
      access = new FieldAccess(read == null ? null : read.withPermissions(permissions), write == null ? null : write.withPermissions(permissions));
    } catch (IllegalArgumentException e) {
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, context + ": " + e.getMessage());
    }
    return new Field(name, config.name(), index, address, lowBit, width, behavior, access, permissions, config.endianness());
  }

  private Register buildRegister(MaskedAddress address, List<Placed> placed, RegisterFileConfig config, int busWidth)
      throws RegmapException {
    List<Field> fields = new ArrayList<>();
    String name = null;
    Set<Endianness> endianness = new LinkedHashSet<>();
    for (Placed p : placed) {
      fields.add(p.field());
      if (name == null)
        name = p.registerName();
      else if (p.registerName() != null && !p.registerName().equals(name))
        logger.warn("Field `{}` asks for register name `{}`, but its register is already named `{}`", p.field().getName(),
                    p.registerName(), name);
      if (p.field().getEndianness() != null)
        endianness.add(p.field().getEndianness());
    }
    if (name == null)
      name = fields.get(0).getName();
    String context = "register `" + name + "`";
    if (endianness.size() > 1)
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, context + ": conflicting endianness settings");
    Endianness order = endianness.isEmpty() ? config.endianness() : endianness.iterator().next();

    int highBit = 0;
    for (Field field : fields)
      highBit = Math.max(highBit, field.getHighBit());
    int words = highBit / busWidth + 1;
    if (words > MAX_WORDS)
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, context + " needs " + words + " words, at most " + MAX_WORDS + " are supported");

    for (int i = 0; i < fields.size(); ++i)
      for (int j = i + 1; j < fields.size(); ++j) {
        Field a = fields.get(i);
        Field b = fields.get(j);
        if (Math.max(a.getLowBit(), b.getLowBit()) <= Math.min(a.getHighBit(), b.getHighBit()))
          throw new RegmapException(DiagnosticCategory.CONFIGURATION, "fields `" + a.getName() + "` and `" + b.getName() + "` intersect at bit " +
                                                                          Math.max(a.getLowBit(), b.getLowBit()));
      }

    if (fields.size() > 1)
      for (Field field : fields)
        for (Direction direction : Direction.values())
          if (field.supports(direction) && field.getCapabilities(direction).canDefer())
            throw new RegmapException(DiagnosticCategory.SIBLING_CAPABILITY_CONFLICT,
                                      context + ": deferring fields cannot share a register with other fields (`" + field.getName() + "`)");

    Register register = new Register(name, address, order, busWidth, words, fields);
    for (Direction direction : Direction.values()) {
      List<AccessCapabilities.Sibling> siblings = new ArrayList<>();
      for (Field field : register.getFields(direction))
        siblings.add(new AccessCapabilities.Sibling(field.getName(), field.getCapabilities(direction)));
      if (!siblings.isEmpty())
        register.setCapabilities(direction, AccessCapabilities.checkSiblings(siblings));
    }
    List<Field> writable = register.getFields(Direction.WRITE);
    if (writable.size() > 1)
      for (Field field : writable)
        field.getAccess().checkMaskable(field.getName());
    return register;
  }

  static String blockName(String registerName, int index, int words, Endianness endianness) {
    if (words == 1)
      return registerName;
    if (words == 2)
      return registerName + ((index == 0) == (endianness == Endianness.LITTLE) ? "_low" : "_high");
    return registerName + "_" + (char)('a' + index);
  }

  private static String ownerOf(Register register, String blockName) {
    if (register.getWordCount() > 1)
      return "block \"" + blockName + "\"";
    if (register.getFields().size() == 1)
      return "field \"" + register.getFields().get(0).getName() + "\"";
    return "register \"" + register.getName() + "\"";
  }

  private static RegmapException arithmeticError(String context, MaskedAddress address, String message) {
    return new RegmapException(new Diagnostic(DiagnosticCategory.ADDRESS_ARITHMETIC, context + ": " + message, List.of(),
                                                         List.of(address), null));
  }
}
