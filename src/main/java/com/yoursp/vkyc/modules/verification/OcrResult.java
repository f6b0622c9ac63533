package com.yoursp.vkyc.modules.verification;

import java.util.Map;

public record OcrResult(Map<String, String> fields, double confidence) {
}
