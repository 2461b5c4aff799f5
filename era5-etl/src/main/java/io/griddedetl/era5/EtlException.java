package io.griddedetl.era5;

/**
 * Base of the checked failures raised by the ETL stages. Each subclass marks the smallest unit
 * (variable, file, processing unit) the failure is isolated to.
 */
public class EtlException extends Exception {
    public EtlException(String message) {
        super(message);
    }

    public EtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
