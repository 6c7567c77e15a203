package com.pgmgen.ir.lambda;

import com.pgmgen.compiler.ast.stmt.IfStmt;
import com.pgmgen.compiler.ast.stmt.Statement;
import com.pgmgen.compiler.formatter.FormatConfig;
import com.pgmgen.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * lambda 渲染测试
 */
class LambdaEmitterTest {

    private final BufferedLambdaSink sink = new BufferedLambdaSink();

    private static Statement statement(String source) {
        return Parser.parse(source, "test.py").getBody().get(0);
    }

    @Test
    @DisplayName("语句 lambda 返回目标变量")
    void testStatement() {
        new LambdaEmitter().emitStatement(sink, "f__lambda__y_0", statement("y = (a + b) * 2\n"),
                Arrays.asList("a", "b"), "y");
        assertThat(sink.getContent())
                .isEqualTo("def f__lambda__y_0(a, b):\n    y = (a + b) * 2\n    return y\n\n");
    }

    @Test
    @DisplayName("条件 lambda 返回表达式")
    void testExpression() {
        IfStmt stmt = (IfStmt) statement("if not a and b > 1:\n    pass\n");
        new LambdaEmitter().emitExpression(sink, "f__lambda__IF_1_0", stmt.getTest(), Arrays.asList("a", "b"));
        assertThat(sink.getContent())
                .isEqualTo("def f__lambda__IF_1_0(a, b):\n    return not a and b > 1\n\n");
    }

    @Test
    @DisplayName("无参数与自定义缩进")
    void testCustomIndent() {
        FormatConfig config = new FormatConfig();
        config.setIndentSize(2);
        new LambdaEmitter(config).emitStatement(sink, "f__lambda__x_0", statement("x = [1, 2]\n"),
                Collections.<String>emptyList(), "x");
        assertThat(sink.getContent()).isEqualTo("def f__lambda__x_0():\n  x = [1, 2]\n  return x\n\n");
    }

    @Test
    @DisplayName("按发出顺序保存，名称不可重复")
    void testSinkOrder() {
        sink.append("b", "def b():\n    return 1\n\n");
        sink.append("a", "def a():\n    return 2\n\n");
        assertThat(sink.getNames()).containsExactly("b", "a");
        assertThat(sink.getSource("a")).isEqualTo("def a():\n    return 2\n\n");
        assertThat(sink.getSource("c")).isNull();
        assertThat(sink.getContent()).startsWith("def b():");
        assertThatThrownBy(() -> sink.append("a", "")).isInstanceOf(IllegalStateException.class);
    }
}
