package io.griddedetl.era5.join;

import io.griddedetl.era5.EtlException;

/** A variable's column roles cannot be resolved, or a registered schema is malformed. */
public class ColumnMappingException extends EtlException {
    public ColumnMappingException(String message) {
        super(message);
    }

    public ColumnMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
