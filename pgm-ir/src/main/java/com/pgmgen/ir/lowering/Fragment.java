package com.pgmgen.ir.lowering;

import com.pgmgen.ir.pgm.BodyRecord;
import com.pgmgen.ir.pgm.PgmFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 尚未组装的片段：一组函数与一组体记录，均保持顺序
 */
public class Fragment {

    private final List<PgmFunction> functions = new ArrayList<>();
    private final List<BodyRecord> body = new ArrayList<>();

    public static Fragment empty() {
        return new Fragment();
    }

    public Fragment addFunction(PgmFunction function) {
        functions.add(function);
        return this;
    }

    public Fragment addBody(BodyRecord record) {
        body.add(record);
        return this;
    }

    /**
     * 追加另一个片段的函数与体记录
     */
    public Fragment append(Fragment other) {
        functions.addAll(other.functions);
        body.addAll(other.body);
        return this;
    }

    public List<PgmFunction> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public List<BodyRecord> getBody() {
        return Collections.unmodifiableList(body);
    }

    public boolean isEmpty() {
        return functions.isEmpty() && body.isEmpty();
    }
}
