package io.griddedetl.era5.orchestrate;

public record StageCount(int succeeded, int failed) {
    public static final StageCount NONE = new StageCount(0, 0);

    public int total() {
        return succeeded + failed;
    }
}
