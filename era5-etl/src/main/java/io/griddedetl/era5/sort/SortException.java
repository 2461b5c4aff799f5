package io.griddedetl.era5.sort;

import io.griddedetl.era5.EtlException;

/** A table could not be sorted; the original file is left as it was. */
public class SortException extends EtlException {
    public SortException(String message) {
        super(message);
    }

    public SortException(String message, Throwable cause) {
        super(message, cause);
    }
}
