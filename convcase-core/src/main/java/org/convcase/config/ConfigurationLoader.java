package org.convcase.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.convcase.options.ConvCaseOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = ConvCaseOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = ConvCaseOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = ConvCaseOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final UnaryOperator<String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, UnaryOperator<String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵. 값이 없는 키는 포함되지 않음
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<ConvCaseConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return Map.of();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 ccase.yaml을 찾습니다.
     */
    private Optional<ConvCaseConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    ConvCaseConfiguration config = yamlMapper.readValue(configFile.toFile(), ConvCaseConfiguration.class);
                    return Optional.ofNullable(config);
                } catch (IOException e) {
                    System.err.println("Warning: Failed to parse " + configFile + ": " + e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(ConvCaseConfiguration config, String profile) {
        var profileConfig = config.getProfiles() == null ? null : config.getProfiles().get(profile);
        if (profileConfig == null) {
            System.err.println("Warning: Profile '" + profile + "' not found in configuration. Using defaults.");
            return Map.of();
        }

        Map<String, String> configMap = new HashMap<>();

        var conversion = profileConfig.getConversion();
        if (conversion != null) {
            putIfPresent(configMap, ConvCaseOptions.Conversion.TO_KEY, conversion.getTo());
            putIfPresent(configMap, ConvCaseOptions.Conversion.FROM_KEY, conversion.getFrom());
        }

        return Map.copyOf(configMap);
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value.trim());
        }
    }
}
