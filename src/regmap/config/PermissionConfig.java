package regmap.config;

import regmap.caps.Permissions;
import regmap.drc.RegmapException;

/** Which kinds of access a field allows, one flag per side of each AXI prot axis. */
public record PermissionConfig(boolean user, boolean privileged, boolean secure, boolean nonsecure, boolean data, boolean instruction) {
  public static final PermissionConfig ALLOW_ALL = new PermissionConfig(true, true, true, true, true, true);

  public Permissions toPermissions() throws RegmapException { return Permissions.of(user, privileged, secure, nonsecure, data, instruction); }
}
