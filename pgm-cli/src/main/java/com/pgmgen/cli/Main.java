package com.pgmgen.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.LogManager;

/**
 * pgmgen CLI 入口点（picocli）
 */
@Command(name = "pgmgen", version = "pgmgen v0.1.0",
         mixinStandardHelpOptions = true,
         description = "把源文件翻译为 PGM 文档与 lambda 源码")
public class Main implements Callable<Integer> {

    @Option(names = {"-f", "--files"}, arity = "1..*", required = true, description = "输入源文件")
    List<File> files;

    @Option(names = {"-p", "--PGMFile"}, defaultValue = "pgm.json", description = "PGM 文档输出路径（默认 ${DEFAULT-VALUE}）")
    File pgmFile;

    @Option(names = {"-l", "--lambdaFile"}, defaultValue = "lambdas.py", description = "lambda 源码输出路径（默认 ${DEFAULT-VALUE}）")
    File lambdaFile;

    @Option(names = {"-a", "--printAst"}, description = "打印语法树")
    boolean printAst;

    @Option(names = "--strict-range", description = "range 端点只接受变量")
    boolean strictRange;

    @Option(names = "--no-validate", description = "跳过文档校验")
    boolean noValidate;

    @Override
    public Integer call() {
        TranslateRunner runner = new TranslateRunner(strictRange, !noValidate);
        if (printAst && !runner.printAst(files)) {
            return 1;
        }
        return runner.translate(files, pgmFile, lambdaFile);
    }

    public static void main(String[] args) {
        installLogging();
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    private static void installLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("警告: 无法加载日志配置 - " + e.getMessage());
        }
    }
}
