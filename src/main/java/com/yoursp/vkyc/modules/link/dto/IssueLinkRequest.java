package com.yoursp.vkyc.modules.link.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class IssueLinkRequest {

    @NotBlank
    @Size(max = 100)
    private String customerRef;
}
