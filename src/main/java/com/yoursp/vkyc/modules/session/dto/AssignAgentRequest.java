package com.yoursp.vkyc.modules.session.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class AssignAgentRequest {

    @NotBlank(message = "agentId is required")
    @Size(max = 50)
    private String agentId;
}
