package github.sarthakdev143.reel_factory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ReelErrorResponse(
        String error,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("raw_response") String rawResponse) {

    public static ReelErrorResponse of(String error) {
        return new ReelErrorResponse(error, null);
    }
}
