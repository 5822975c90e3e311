package com.namekis.treewatcher;

public final class LoadResult {
    private final LoadStatus status;
    private final Forest forest;
    private final LazyTreeModel model;
    private final int lineCount;
    private final int itemCount;

    private LoadResult(LoadStatus status, Forest forest, LazyTreeModel model, int lineCount, int itemCount) {
        this.status = status;
        this.forest = forest;
        this.model = model;
        this.lineCount = lineCount;
        this.itemCount = itemCount;
    }

    static LoadResult emptyInput() {
        return new LoadResult(LoadStatus.EMPTY_INPUT, Forest.empty(), null, 0, 0);
    }

    static LoadResult noRootFound(int lineCount) {
        return new LoadResult(LoadStatus.NO_ROOT_FOUND, Forest.empty(), null, lineCount, 0);
    }

    static LoadResult superseded(int lineCount) {
        return new LoadResult(LoadStatus.SUPERSEDED, Forest.empty(), null, lineCount, 0);
    }

    static LoadResult built(Forest forest, int lineCount, int itemCount) {
        return new LoadResult(LoadStatus.LOADED, forest, null, lineCount, itemCount);
    }

    LoadResult withModel(LazyTreeModel model) {
        return new LoadResult(status, forest, model, lineCount, itemCount);
    }

    public LoadStatus status() {
        return status;
    }

    public boolean isLoaded() {
        return status == LoadStatus.LOADED;
    }

    public Forest forest() {
        return forest;
    }

    /** Null unless {@link #isLoaded()}. */
    public LazyTreeModel model() {
        return model;
    }

    public int lineCount() {
        return lineCount;
    }

    public int itemCount() {
        return itemCount;
    }

    public String message() {
        switch (status) {
        case LOADED:
            return "Loaded " + lineCount + " lines.";
        case EMPTY_INPUT:
            return "File is empty";
        case NO_ROOT_FOUND:
            return "No tree structure found.";
        default:
            return "Superseded by a newer load.";
        }
    }

    @Override
    public String toString() {
        return status + ": " + message();
    }
}
