package me.golemcore.clarity.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Failure details of a Turn. Present only while the Turn is in
 * {@link TurnState#FAILED}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TurnError {

    public static final String DEFAULT_DOMAIN = "clarity.turn";
    public static final int DEFAULT_CODE = 500;
    public static final String DEFAULT_USER_FACING_KEY = "error.generic";

    private String domain;
    private int code;
    private String userFacingKey;
    private String debugMessage;
}
