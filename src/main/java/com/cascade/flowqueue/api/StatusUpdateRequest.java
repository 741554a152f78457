package com.cascade.flowqueue.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateRequest {

    @NotBlank
    @Pattern(regexp = "(?i)pending|sending|sent|failed", message = "status must be pending, sending, sent or failed")
    private String status;

    @PositiveOrZero
    private Integer messageIndex;
}
