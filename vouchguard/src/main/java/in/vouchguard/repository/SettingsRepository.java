package in.vouchguard.repository;

import java.util.Optional;

/**
 * Key/value store backing the app_config table.
 */
public interface SettingsRepository {
    Optional<String> get(String key);

    void set(String key, String value);
}
