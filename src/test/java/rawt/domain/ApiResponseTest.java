package rawt.domain;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rawt.common.EContentType;
import rawt.domain.job.EJobStatus;
import rawt.domain.job.PrintJobInfo;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for ApiResponse
 * @since 19/10/2026
 */
class ApiResponseTest {

    private final Gson gson = new Gson();

    @Test
    @DisplayName("Should create success response")
    void shouldCreateSuccessResponse() {
        // When
        ApiResponse<String> response = ApiResponse.success("job-1");

        // Then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData()).isEqualTo("job-1");
        assertThat(response.getMessage()).isEqualTo("Operation completed successfully");
        assertThat(response.getTimestamp()).isGreaterThan(0);
    }

    @Test
    @DisplayName("Should create error response without data")
    void shouldCreateErrorResponse() {
        // When
        ApiResponse<PrintJobInfo> response = ApiResponse.error("Job not found: job-9");

        // Then
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getMessage()).isEqualTo("Job not found: job-9");
        assertThat(response.getData()).isNull();
    }

    @Test
    @DisplayName("Should serialize job info inside the envelope")
    void shouldSerializeJobInfo() {
        // Given
        PrintJobInfo info = new PrintJobInfo("job-1", "Receipt", EContentType.RAW, EJobStatus.BLOCKED,
                1000L, 0L, 0L, "Printer not configured", null, null, -1, -1, 0, 0);

        // When
        JsonObject json = gson.toJsonTree(ApiResponse.success("Print job waiting", info)).getAsJsonObject();

        // Then
        assertThat(json.get("success").getAsBoolean()).isTrue();
        assertThat(json.get("message").getAsString()).isEqualTo("Print job waiting");
        JsonObject data = json.getAsJsonObject("data");
        assertThat(data.get("status").getAsString()).isEqualTo("BLOCKED");
        assertThat(data.get("blockedReason").getAsString()).isEqualTo("Printer not configured");
        assertThat(data.has("errorClass")).isFalse();
    }
}
