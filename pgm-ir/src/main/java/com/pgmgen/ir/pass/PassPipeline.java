package com.pgmgen.ir.pass;

import com.pgmgen.ir.pgm.PgmDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 文档 Pass 管线：组装后的文档依次经过每个 pass。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<PgmPass> passes = new ArrayList<>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线（仅包含校验）。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new PgmValidator());
        return pipeline;
    }

    public void addPass(PgmPass pass) {
        passes.add(pass);
    }

    public List<PgmPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    public PgmDocument execute(PgmDocument document) {
        PgmDocument result = document;
        for (PgmPass pass : passes) {
            LOG.fine(() -> "Running pass " + pass.getName());
            result = pass.run(result);
        }
        return result;
    }
}
