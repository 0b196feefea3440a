package org.convcase.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConvCaseConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    /**
     * 개별 프로파일 설정
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {

        @JsonProperty("conversion")
        private ConversionConfiguration conversion;
    }

    /**
     * 변환 기본값. 케이스 이름은 {@link org.convcase.model.Case#parse(String)} 규칙을 따릅니다.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConversionConfiguration {

        @JsonProperty("to")
        private String to;

        @JsonProperty("from")
        private String from;
    }
}
