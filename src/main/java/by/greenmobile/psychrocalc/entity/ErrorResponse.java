package by.greenmobile.psychrocalc.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * JSON body of every rejected API call.
 */
@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /** INVALID_INPUT, CONVERGENCE_FAILURE or VALIDATION. */
    private String error;

    private String message;

    /** Only for convergence failures. */
    private Integer iterations;

    private String requestId;
}
