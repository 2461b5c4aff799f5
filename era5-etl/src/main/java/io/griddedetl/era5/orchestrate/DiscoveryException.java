package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.EtlException;

/** No (year, month) could be derived for a raw file, or the input root cannot be scanned. */
public class DiscoveryException extends EtlException {
    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
