package com.pgmgen.ir;

import com.pgmgen.compiler.ast.Module;
import com.pgmgen.compiler.parser.Parser;
import com.pgmgen.ir.backend.PgmJsonWriter;
import com.pgmgen.ir.lambda.BufferedLambdaSink;
import com.pgmgen.ir.lambda.LambdaEmitter;
import com.pgmgen.ir.lowering.AstToPgmLowering;
import com.pgmgen.ir.lowering.Fragment;
import com.pgmgen.ir.lowering.PgmAssembler;
import com.pgmgen.ir.pass.PassPipeline;
import com.pgmgen.ir.pgm.PgmDocument;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * PGM 翻译门面。
 * 管线：源码 → Lexer → Parser → 语法树 → PGM 片段 → 文档 → Pass → JSON / lambda 源码。
 */
public class PgmTranslator {

    private static final Logger LOG = Logger.getLogger(PgmTranslator.class.getName());

    private final TranslationOptions options;
    private final PassPipeline pipeline;

    public PgmTranslator() {
        this(new TranslationOptions());
    }

    public PgmTranslator(TranslationOptions options) {
        this(options, options.isValidate() ? PassPipeline.createDefault() : new PassPipeline());
    }

    public PgmTranslator(TranslationOptions options, PassPipeline pipeline) {
        this.options = options;
        this.pipeline = pipeline;
    }

    public TranslationOptions getOptions() {
        return options;
    }

    public PassPipeline getPipeline() {
        return pipeline;
    }

    /**
     * 翻译源代码。
     *
     * @param source   源代码
     * @param fileName 文件名
     */
    public TranslationResult translate(String source, String fileName) {
        return translateModules(Collections.singletonList(Parser.parse(source, fileName)));
    }

    /**
     * 翻译多个源文件，结果合并为一个文档。
     */
    public TranslationResult translateFiles(List<File> files) throws IOException {
        List<Module> modules = new ArrayList<>();
        for (File file : files) {
            String source = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
            modules.add(Parser.parse(source, file.getName()));
        }
        return translateModules(modules);
    }

    /**
     * 翻译已解析的语法树集合。
     */
    public TranslationResult translateModules(List<Module> modules) {
        BufferedLambdaSink sink = new BufferedLambdaSink();
        AstToPgmLowering lowering = new AstToPgmLowering(sink,
                new LambdaEmitter(options.getFormatConfig()), options.isStrictRangeBounds());
        Fragment fragment = lowering.lower(modules);

        PgmDocument document = new PgmAssembler(options.getClock())
                .assemble(fragment, lowering.getStart(), options.getDocumentName());
        document = pipeline.execute(document);

        LOG.info("Translated " + modules.size() + " module(s): " + document.getFunctions().size()
                + " function(s), " + sink.size() + " lambda(s)");
        return new TranslationResult(document, sink.getContent());
    }

    /**
     * 翻译并保存。两个文件先写到同目录的临时文件，都成功后才移动到目标位置；
     * 任何一步失败都不留下输出。
     */
    public TranslationResult translateAndSave(List<File> files, File pgmFile, File lambdaFile) throws IOException {
        TranslationResult result = translateFiles(files);
        requireWritableTarget(pgmFile);
        requireWritableTarget(lambdaFile);

        File pgmTemp = null;
        File lambdaTemp = null;
        boolean pgmMoved = false;
        try {
            pgmTemp = createSibling(pgmFile);
            new PgmJsonWriter().write(result.getDocument(), pgmTemp);
            lambdaTemp = createSibling(lambdaFile);
            Files.write(lambdaTemp.toPath(), result.getLambdaSource().getBytes(StandardCharsets.UTF_8));

            moveInto(pgmTemp, pgmFile);
            pgmMoved = true;
            moveInto(lambdaTemp, lambdaFile);
        } catch (IOException e) {
            deleteQuietly(pgmTemp);
            deleteQuietly(lambdaTemp);
            if (pgmMoved) {
                deleteQuietly(pgmFile);
            }
            throw e;
        }
        LOG.info("Generated: " + pgmFile.getPath());
        LOG.info("Generated: " + lambdaFile.getPath());
        return result;
    }

    private static void requireWritableTarget(File target) throws IOException {
        if (target.isDirectory()) {
            throw new IOException("Output path is a directory: " + target.getPath());
        }
    }

    private static File createSibling(File target) throws IOException {
        File parent = target.getAbsoluteFile().getParentFile();
        if (parent != null) {
            Files.createDirectories(parent.toPath());
        }
        return Files.createTempFile(parent == null ? null : parent.toPath(),
                "." + target.getName() + ".", ".tmp").toFile();
    }

    private static void moveInto(File temp, File target) throws IOException {
        try {
            Files.move(temp.toPath(), target.toPath(),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(File file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file.toPath());
        } catch (IOException e) {
            LOG.warning("Could not remove " + file.getPath() + ": " + e.getMessage());
        }
    }
}
