package io.griddedetl.era5.extract;

import io.griddedetl.era5.EtlException;

/** A raw file could not be opened, or none of its variables decoded. */
public class DecodeException extends EtlException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
