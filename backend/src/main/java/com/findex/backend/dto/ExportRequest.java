package com.findex.backend.dto;

import com.findex.backend.model.FailurePolicy;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportRequest {
    @NotEmpty(message = "At least one region must be selected")
    @Size(max = 100)
    private List<String> regions;
    /** Overrides findex.export.failure-policy for this export. */
    private FailurePolicy failurePolicy;
}
