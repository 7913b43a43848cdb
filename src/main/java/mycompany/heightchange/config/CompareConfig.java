package mycompany.heightchange.config;

import mycompany.heightchange.change.MetricConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Validated settings of one comparison run. Immutable and shared by all workers.
 */
public final class CompareConfig {

    public static final String DEFAULT_CHANGE_LIST = "changed.txt";

    private final Path referenceDir;
    private final Path targetDir;
    private final Path saveDir;
    private final Path referenceLasDir;
    private final Path targetLasDir;
    private final Path saveLasDir;
    private final boolean copyTif;
    private final boolean copyLas;
    private final int threads;
    private final Path changeList;
    private final MetricConfig metrics;

    private CompareConfig(Builder builder) {
        this.referenceDir = Objects.requireNonNull(builder.referenceDir, "referenceDir");
        this.targetDir = Objects.requireNonNull(builder.targetDir, "targetDir");
        this.saveDir = builder.saveDir;
        this.referenceLasDir = builder.referenceLasDir;
        this.targetLasDir = builder.targetLasDir;
        this.saveLasDir = builder.saveLasDir;
        this.copyTif = builder.copyTif;
        this.copyLas = builder.copyLas;
        this.threads = builder.threads;
        this.changeList = builder.changeList;
        this.metrics = Objects.requireNonNull(builder.metrics, "metrics");
        if (copyTif && saveDir == null) {
            throw new IllegalArgumentException("copy_tif requires save_dir");
        }
        if (copyLas && (referenceLasDir == null || targetLasDir == null || saveLasDir == null)) {
            throw new IllegalArgumentException("copy_las requires reference_las_dir, target_las_dir and save_las_dir");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getReferenceDir() { return referenceDir; }
    public Path getTargetDir() { return targetDir; }
    public Path getSaveDir() { return saveDir; }
    public Path getReferenceLasDir() { return referenceLasDir; }
    public Path getTargetLasDir() { return targetLasDir; }
    public Path getSaveLasDir() { return saveLasDir; }
    public boolean isCopyTif() { return copyTif; }
    public boolean isCopyLas() { return copyLas; }
    public int getThreads() { return threads; }
    public Path getChangeList() { return changeList; }
    public MetricConfig getMetrics() { return metrics; }

    /**
     * Worker pool size; 0 means one worker per available processor.
     */
    public int getEffectiveThreads() {
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    public static final class Builder {
        private Path referenceDir;
        private Path targetDir;
        private Path saveDir;
        private Path referenceLasDir;
        private Path targetLasDir;
        private Path saveLasDir;
        private boolean copyTif;
        private boolean copyLas;
        private int threads;
        private Path changeList = Paths.get(DEFAULT_CHANGE_LIST);
        private MetricConfig metrics;

        private Builder() {
        }

        public Builder referenceDir(Path referenceDir) { this.referenceDir = referenceDir; return this; }
        public Builder targetDir(Path targetDir) { this.targetDir = targetDir; return this; }
        public Builder saveDir(Path saveDir) { this.saveDir = saveDir; return this; }
        public Builder referenceLasDir(Path referenceLasDir) { this.referenceLasDir = referenceLasDir; return this; }
        public Builder targetLasDir(Path targetLasDir) { this.targetLasDir = targetLasDir; return this; }
        public Builder saveLasDir(Path saveLasDir) { this.saveLasDir = saveLasDir; return this; }
        public Builder copyTif(boolean copyTif) { this.copyTif = copyTif; return this; }
        public Builder copyLas(boolean copyLas) { this.copyLas = copyLas; return this; }
        public Builder threads(int threads) { this.threads = threads; return this; }
        public Builder changeList(Path changeList) { this.changeList = changeList; return this; }
        public Builder metrics(MetricConfig metrics) { this.metrics = metrics; return this; }

        public CompareConfig build() {
            return new CompareConfig(this);
        }
    }
}
