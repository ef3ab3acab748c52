package ca.gc.cra.waymark.application;

/**
 * Implemented by objects that expose class-level settings as per-instance overridable attributes.
 *
 * <p>The host owns its override table, usually as a {@code private final InstanceOverrides} field, so overrides
 * disappear with the host and the registry keeps no per-instance state.</p>
 *
 * @since 0.1.0
 * @see SettingSlot
 */
public interface OverridableHost {
  /**
   * Returns this host's override table.
   *
   * @return the same table on every call
   */
  InstanceOverrides settingOverrides();
}
