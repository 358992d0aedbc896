package regmap.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import regmap.drc.DiagnosticCategory;
import regmap.drc.RegmapException;
import regmap.model.Endianness;

/**
 * Reads a register file description from YAML.
 *
 * <pre>
 * name: ctrl
 * bus-width: 32
 * endianness: little
 * fields:
 *   - name: enable
 *     address: 0x0
 *     bitrange: 0
 *     behavior: control
 *   - name: counter
 *     address: 0x8
 *     bitrange: 63..0
 *     behavior: { type: status }
 * </pre>
 *
 * Unknown keys are reported as warnings and ignored.
 */
public class ConfigLoader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public RegisterFileConfig load(File file) throws RegmapException {
    try (InputStream in = new FileInputStream(file)) {
      return load(in, file.getName());
    } catch (IOException e) {
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, "register file description " + file + " could not be read: " + e.getMessage());
    }
  }

  public RegisterFileConfig load(InputStream in, String source) throws RegmapException {
    Object readData;
    try {
      readData = new Yaml().load(in);
    } catch (YAMLException e) {
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, "malformed YAML in " + source + ": " + e.getMessage());
    }
    logger.debug("Loaded register file description from {}", source);
    return parse(readData);
  }

  public RegisterFileConfig load(String yamlText) throws RegmapException {
    Object readData;
    try {
      readData = new Yaml().load(yamlText);
    } catch (YAMLException e) {
      throw new RegmapException(DiagnosticCategory.CONFIGURATION, "malformed YAML: " + e.getMessage());
    }
    return parse(readData);
  }

  /** Translates the YAML object tree into a register file configuration. */
  public RegisterFileConfig parse(Object readData) throws RegmapException {
    Map<?, ?> root = asMap(readData, "register file description");
    String name = null;
    int busWidth = 32;
    Endianness endianness = Endianness.LITTLE;
    List<?> fields = List.of();
    for (Object setting : root.keySet()) {
      Object value = root.get(setting);
      switch (setting.toString()) {
      case "name":
        name = asString(value, "name");
        break;
      case "bus-width":
        busWidth = asInt(value, "bus-width");
        break;
      case "endianness":
        endianness = asEndianness(value, "endianness");
        break;
      case "fields":
        if (!(value instanceof List))
          throw configError("`fields` must be a list");
        fields = (List<?>)value;
        break;
      default:
        logger.warn("Ignoring unknown register file setting '{}'", setting);
      }
    }
    if (name == null)
      throw configError("register file description has no name");
    try {
      RegisterFileConfig.Builder builder = RegisterFileConfig.builder(name).setBusWidth(busWidth).setEndianness(endianness);
      int index = 0;
      for (Object field : fields)
        builder.addField(parseField(asMap(field, "field #" + index++)));
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw configError(e.getMessage());
    }
  }

  private FieldConfig parseField(Map<?, ?> entry) throws RegmapException {
    String name = null, registerName = null;
    Object address = null;
    Integer high = null, low = null, fieldRepeat = null, fieldStride = null;
    Long stride = null;
    int repeat = 1;
    Endianness endianness = null;
    BehaviorConfig behavior = null;
    PermissionConfig permissions = PermissionConfig.ALLOW_ALL;
    Object behaviorSetting = null;
    for (Object setting : entry.keySet()) {
      Object value = entry.get(setting);
      switch (setting.toString()) {
      case "name":
        name = asString(value, "name");
        break;
      case "register-name":
        registerName = asString(value, "register-name");
        break;
      case "address":
        address = value;
        break;
      case "bitrange":
        int[] range = parseBitrange(value);
        high = range[0];
        low = range[1];
        break;
      case "repeat":
        repeat = asInt(value, "repeat");
        break;
      case "field-repeat":
        fieldRepeat = asInt(value, "field-repeat");
        break;
      case "stride":
        stride = asLong(value, "stride");
        break;
      case "field-stride":
        fieldStride = asInt(value, "field-stride");
        break;
      case "endianness":
        endianness = asEndianness(value, "endianness");
        break;
      case "permissions":
        permissions = parsePermissions(asMap(value, "permissions"));
        break;
      case "behavior":
        behaviorSetting = value;
        break;
      default:
        logger.warn("Ignoring unknown field setting '{}'{}", setting, name != null ? " of field `" + name + "`" : "");
      }
    }
    if (name == null)
      throw configError("field without a name");
    if (behaviorSetting == null)
      throw configError("field `" + name + "` has no behavior");
    behavior = parseBehavior(behaviorSetting, name);
    FieldConfig.Builder builder = FieldConfig.builder(name, address, behavior)
                                      .setRegisterName(registerName)
                                      .setEndianness(endianness)
                                      .setRepeat(repeat)
                                      .setFieldRepeat(fieldRepeat)
                                      .setStride(stride)
                                      .setFieldStride(fieldStride)
                                      .setPermissions(permissions);
    if (high != null)
      builder.setBitrange(high, low);
    return builder.build();
  }

  /** Accepts {@code 7..0}, {@code 3} or an integer. */
  static int[] parseBitrange(Object value) throws RegmapException {
    if (value instanceof Integer)
      return new int[] {(Integer)value, (Integer)value};
    if (!(value instanceof String))
      throw configError("invalid bitrange " + value);
    String text = ((String)value).trim();
    try {
      int sep = text.indexOf("..");
      if (sep < 0) {
        int bit = Integer.parseInt(text);
        return new int[] {bit, bit};
      }
      int high = Integer.parseInt(text.substring(0, sep).trim());
      int low = Integer.parseInt(text.substring(sep + 2).trim());
      return new int[] {high, low};
    } catch (NumberFormatException e) {
      throw configError("invalid bitrange '" + text + "', expected <high>..<low>");
    }
  }

  private static PermissionConfig parsePermissions(Map<?, ?> map) throws RegmapException {
    boolean user = true, privileged = true, secure = true, nonsecure = true, data = true, instruction = true;
    for (Object setting : map.keySet()) {
      boolean allowed = asBoolean(map.get(setting), "permissions." + setting);
      switch (setting.toString()) {
      case "user":
        user = allowed;
        break;
      case "privileged":
        privileged = allowed;
        break;
      case "secure":
        secure = allowed;
        break;
      case "nonsecure":
        nonsecure = allowed;
        break;
      case "data":
        data = allowed;
        break;
      case "instruction":
        instruction = allowed;
        break;
      default:
        logger.warn("Ignoring unknown permission '{}'", setting);
      }
    }
    return new PermissionConfig(user, privileged, secure, nonsecure, data, instruction);
  }

  private static BehaviorConfig parseBehavior(Object value, String fieldName) throws RegmapException {
    String type;
    Map<?, ?> params;
    if (value instanceof String) {
      type = (String)value;
      params = Map.of();
    } else {
      params = asMap(value, "behavior of field `" + fieldName + "`");
      if (!params.containsKey("type"))
        throw configError("behavior of field `" + fieldName + "` has no type");
      type = asString(params.get("type"), "type");
    }
    try {
      switch (type) {
      case ConstantConfig.TAG:
        if (!params.containsKey("value"))
          throw configError("constant field `" + fieldName + "` needs a value");
        return new ConstantConfig(asLong(params.get("value"), "value"));
      case ControlConfig.TAG:
        return new ControlConfig(params.containsKey("reset") ? asLong(params.get("reset"), "reset") : 0);
      case StatusConfig.TAG:
        return new StatusConfig();
      case StrobeConfig.TAG:
        return new StrobeConfig();
      case ExternalConfig.TAG:
        return new ExternalConfig(!params.containsKey("read") || asBoolean(params.get("read"), "read"),
                                  !params.containsKey("write") || asBoolean(params.get("write"), "write"),
                                  params.containsKey("deferring") && asBoolean(params.get("deferring"), "deferring"));
      default:
        Map<String, Object> custom = new LinkedHashMap<>();
        for (Object key : params.keySet())
          if (!key.toString().equals("type"))
            custom.put(key.toString(), params.get(key));
        return new CustomConfig(type, custom);
      }
    } catch (IllegalArgumentException e) {
      throw configError("field `" + fieldName + "`: " + e.getMessage());
    }
  }

  private static Map<?, ?> asMap(Object value, String what) throws RegmapException {
    if (!(value instanceof Map))
      throw configError(what + " must be a mapping");
    return (Map<?, ?>)value;
  }

  private static String asString(Object value, String what) throws RegmapException {
    if (!(value instanceof String))
      throw configError("`" + what + "` must be a string, got " + value);
    return (String)value;
  }

  private static int asInt(Object value, String what) throws RegmapException {
    if (!(value instanceof Integer))
      throw configError("`" + what + "` must be an integer, got " + value);
    return (Integer)value;
  }

  private static long asLong(Object value, String what) throws RegmapException {
    if (value instanceof Integer || value instanceof Long)
      return ((Number)value).longValue();
    throw configError("`" + what + "` must be an integer, got " + value);
  }

  private static boolean asBoolean(Object value, String what) throws RegmapException {
    if (!(value instanceof Boolean))
      throw configError("`" + what + "` must be true or false, got " + value);
    return (Boolean)value;
  }

  private static Endianness asEndianness(Object value, String what) throws RegmapException {
    try {
      return Endianness.fromName(asString(value, what));
    } catch (IllegalArgumentException e) {
      throw configError(e.getMessage());
    }
  }

  private static RegmapException configError(String message) { return new RegmapException(DiagnosticCategory.CONFIGURATION, message); }
}
