package io.griddedetl.era5.join;

import io.griddedetl.era5.EtlException;

/** No variable of a processing unit could be joined. */
public class JoinException extends EtlException {
    public JoinException(String message) {
        super(message);
    }

    public JoinException(String message, Throwable cause) {
        super(message, cause);
    }
}
