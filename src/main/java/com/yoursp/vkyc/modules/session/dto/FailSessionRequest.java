package com.yoursp.vkyc.modules.session.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class FailSessionRequest {

    @NotNull(message = "reason is required")
    @Pattern(regexp = "^(AGENT_ABORTED|USER_LEFT|CLIENT_ERROR)$",
            message = "reason must be AGENT_ABORTED, USER_LEFT, or CLIENT_ERROR")
    private String reason;
}
