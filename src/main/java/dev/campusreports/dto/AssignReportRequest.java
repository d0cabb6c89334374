package dev.campusreports.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignReportRequest {

    /** Staff identifier of the chosen resolver. Checked by the service so an empty pick is a VALIDATION_ERROR. */
    private String resolverStaffId;

    @Size(max = 1000, message = "Assignment note must be at most 1000 characters")
    private String note;
}
