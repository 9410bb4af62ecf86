package com.libragraph.batchsim.core.config;

import com.libragraph.batchsim.core.input.InputObjectCache;
import com.libragraph.batchsim.core.value.CurrentValueCache;
import com.libragraph.batchsim.core.value.ValueEvaluator;
import com.libragraph.batchsim.util.ConfigMaps;
import com.libragraph.batchsim.util.image.ImageSize;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable per-task view of the job: the config tree, the running file/image/object
 * indices, the input objects visible to this task and the per-task value memo.
 * <p>
 * One context belongs to one thread at a time. Parallel work gets its own copy from
 * {@link #copyForTask()}.
 */
public class JobContext {

    /** Branches that value evaluation may rewrite, so each task gets a private copy. */
    public static final List<String> TASK_BRANCHES = List.of("gal", "psf", "pix", "image", "output");

    private final Map<String, Object> config;
    private final ValueEvaluator evaluator;
    private final CurrentValueCache currentValues = new CurrentValueCache();
    private InputObjectCache inputs;

    private int fileNum;
    private int imageNum;
    private int objNum;
    private IndexKey indexKey = IndexKey.FILE_NUM;
    private ImageSize forcedImageSize;

    public JobContext(Map<String, Object> config, InputObjectCache inputs, ValueEvaluator evaluator) {
        this.config = config;
        this.inputs = inputs;
        this.evaluator = evaluator;
    }

    /**
     * Copy for an independent unit of work. The task branches are deep-copied, the
     * {@code input} branch and the input cache are shared, and the value memo starts
     * empty.
     */
    public JobContext copyForTask() {
        JobContext copy = new JobContext(ConfigMaps.copyBranches(config, TASK_BRANCHES), inputs, evaluator);
        copy.fileNum = fileNum;
        copy.imageNum = imageNum;
        copy.objNum = objNum;
        copy.indexKey = indexKey;
        copy.forcedImageSize = forcedImageSize;
        return copy;
    }

    public Map<String, Object> config() {
        return config;
    }

    public ValueEvaluator evaluator() {
        return evaluator;
    }

    public CurrentValueCache currentValues() {
        return currentValues;
    }

    public InputObjectCache inputs() {
        return inputs;
    }

    /** Rebinds this context to a worker's own view of the input objects. */
    public JobContext withInputs(InputObjectCache inputs) {
        this.inputs = inputs;
        return this;
    }

    public Map<String, Object> branch(String name) {
        return ConfigMaps.subMap(config, name);
    }

    public Map<String, Object> branchOrCreate(String name) {
        return ConfigMaps.subMapOrCreate(config, name);
    }

    // -- running indices --

    public void startFile(int fileNum) {
        this.fileNum = fileNum;
        this.indexKey = IndexKey.FILE_NUM;
    }

    public void startImage(int imageNum) {
        this.imageNum = imageNum;
        this.indexKey = IndexKey.IMAGE_NUM;
    }

    public void startObject(int objNum) {
        this.objNum = objNum;
        this.indexKey = IndexKey.OBJ_NUM;
    }

    public int fileNum() {
        return fileNum;
    }

    public int imageNum() {
        return imageNum;
    }

    public int objNum() {
        return objNum;
    }

    public IndexKey indexKey() {
        return indexKey;
    }

    public int index() {
        return index(indexKey);
    }

    public int index(IndexKey key) {
        switch (key) {
            case FILE_NUM:
                return fileNum;
            case IMAGE_NUM:
                return imageNum;
            default:
                return objNum;
        }
    }

    // -- image size coercion (data cubes) --

    public Optional<ImageSize> forcedImageSize() {
        return Optional.ofNullable(forcedImageSize);
    }

    public void forceImageSize(ImageSize size) {
        this.forcedImageSize = size;
    }

    // -- value parsing shortcuts --

    public <T> ParsedValue<T> parse(Map<String, Object> parent, String key, Class<T> type) {
        return evaluator.parse(parent, key, this, type);
    }

    public <T> T parseValue(Map<String, Object> parent, String key, Class<T> type) {
        return parse(parent, key, type).value();
    }

    public <T> T parseValue(Map<String, Object> parent, String key, Class<T> type, T defaultValue) {
        if (parent == null || !parent.containsKey(key)) {
            return defaultValue;
        }
        return parse(parent, key, type).value();
    }
}
