package com.yoursp.vkyc.modules.session.dto;

import com.yoursp.vkyc.model.enums.SessionMode;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@NoArgsConstructor
public class ChooseModeRequest {

    @NotNull(message = "mode is required")
    private SessionMode mode;

    /** Required when mode is SCHEDULED. */
    private OffsetDateTime scheduledAt;
}
