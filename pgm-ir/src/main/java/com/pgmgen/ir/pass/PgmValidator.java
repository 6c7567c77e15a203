package com.pgmgen.ir.pass;

import com.pgmgen.ir.pgm.BodyRecord;
import com.pgmgen.ir.pgm.PgmDocument;
import com.pgmgen.ir.pgm.PgmFunction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 文档校验：
 * <ul>
 *   <li>函数名唯一</li>
 *   <li>顶层、容器与循环体内的每条非外部体记录都引用已定义的函数</li>
 * </ul>
 * 收集全部问题后一次抛出。
 */
public class PgmValidator implements PgmPass {

    @Override
    public String getName() {
        return "PgmValidator";
    }

    @Override
    public PgmDocument run(PgmDocument document) {
        List<String> problems = new ArrayList<>();
        Set<String> defined = new HashSet<>();
        for (PgmFunction function : document.getFunctions()) {
            if (!defined.add(function.getName())) {
                problems.add("duplicate function '" + function.getName() + "'");
            }
        }

        checkRecords(document.getBody(), "document body", defined, problems);
        for (PgmFunction function : document.getFunctions()) {
            checkRecords(function.getNestedBody(), function.getName(), defined, problems);
        }

        if (!problems.isEmpty()) {
            throw new PgmValidationException(problems);
        }
        return document;
    }

    private static void checkRecords(List<BodyRecord> records, String owner,
                                     Set<String> defined, List<String> problems) {
        for (BodyRecord record : records) {
            if (!record.isExternal() && !defined.contains(record.getName())) {
                problems.add("'" + record.getName() + "' referenced from " + owner + " is not defined");
            }
        }
    }
}
