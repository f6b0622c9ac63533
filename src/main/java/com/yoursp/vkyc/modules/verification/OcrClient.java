package com.yoursp.vkyc.modules.verification;

import com.yoursp.vkyc.model.enums.DocumentType;

/**
 * External OCR capability.
 */
public interface OcrClient {

    /**
     * @throws com.yoursp.vkyc.modules.verification.exception.OcrUnavailableException
     *         if the OCR service fails or cannot read the image
     */
    OcrResult extract(byte[] image, DocumentType documentType);
}
