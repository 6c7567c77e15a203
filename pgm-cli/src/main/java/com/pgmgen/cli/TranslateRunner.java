package com.pgmgen.cli;

import com.pgmgen.compiler.ast.Module;
import com.pgmgen.compiler.formatter.AstDumper;
import com.pgmgen.compiler.parser.ParseException;
import com.pgmgen.compiler.parser.Parser;
import com.pgmgen.ir.PgmTranslator;
import com.pgmgen.ir.TranslationOptions;
import com.pgmgen.ir.TranslationResult;
import com.pgmgen.ir.lowering.LoweringException;
import com.pgmgen.ir.pass.PgmValidationException;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * 翻译执行器
 */
public class TranslateRunner {

    private final boolean strictRange;
    private final boolean validate;
    private PrintStream out = System.out;
    private PrintStream err = System.err;

    public TranslateRunner(boolean strictRange, boolean validate) {
        this.strictRange = strictRange;
        this.validate = validate;
    }

    public void setOut(PrintStream out) {
        this.out = out;
    }

    public void setErr(PrintStream err) {
        this.err = err;
    }

    /**
     * 翻译文件并写出结果，返回退出码
     */
    public int translate(List<File> files, File pgmFile, File lambdaFile) {
        if (!checkFiles(files)) {
            return 1;
        }
        TranslationOptions options = new TranslationOptions();
        options.setDocumentName(pgmFile.getName());
        options.setStrictRangeBounds(strictRange);
        options.setValidate(validate);
        try {
            TranslationResult result = new PgmTranslator(options).translateAndSave(files, pgmFile, lambdaFile);
            out.println("翻译成功: " + result.getDocument().getFunctions().size() + " 个函数 -> "
                    + pgmFile.getPath() + ", " + lambdaFile.getPath());
            return 0;
        } catch (ParseException e) {
            err.println("错误: 语法错误 - " + e.getMessage());
        } catch (LoweringException e) {
            err.println("错误: " + e.getMessage());
        } catch (PgmValidationException e) {
            err.println("错误: " + e.getMessage());
        } catch (IOException e) {
            err.println("错误: 读写文件失败 - " + e.getMessage());
        }
        return 1;
    }

    /**
     * 打印每个文件的语法树，解析失败返回 false
     */
    public boolean printAst(List<File> files) {
        if (!checkFiles(files)) {
            return false;
        }
        AstDumper dumper = new AstDumper();
        for (File file : files) {
            try {
                String source = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
                Module module = Parser.parse(source, file.getName());
                out.println("# " + file.getPath());
                out.println(dumper.dump(module));
            } catch (ParseException e) {
                err.println("错误: 语法错误 - " + e.getMessage());
                return false;
            } catch (IOException e) {
                err.println("错误: 读取文件失败 - " + e.getMessage());
                return false;
            }
        }
        return true;
    }

    private boolean checkFiles(List<File> files) {
        for (File file : files) {
            if (!file.isFile()) {
                err.println("错误: 文件不存在 - " + file.getPath());
                return false;
            }
        }
        return true;
    }
}
