package com.pgmgen.ir.lowering;

import com.pgmgen.ir.pgm.BodyInput;
import com.pgmgen.ir.pgm.CallInput;
import com.pgmgen.ir.pgm.CallSource;
import com.pgmgen.ir.pgm.FunctionSource;
import com.pgmgen.ir.pgm.SourceDescriptor;
import com.pgmgen.ir.pgm.VariableInput;
import com.pgmgen.ir.pgm.VariableSource;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 来源列表的展开与去重，保持首次出现顺序
 */
final class SourceLists {

    private SourceLists() {
    }

    /**
     * assign 函数的 sources：变量名，以及被调函数名及其实参中的变量名
     */
    static List<FunctionSource> functionSources(List<SourceDescriptor> sources) {
        Set<FunctionSource> result = new LinkedHashSet<>();
        collectFunctionSources(sources, result);
        return new ArrayList<>(result);
    }

    private static void collectFunctionSources(List<SourceDescriptor> sources, Set<FunctionSource> out) {
        for (SourceDescriptor src : sources) {
            if (src instanceof VariableSource) {
                out.add(FunctionSource.variable(((VariableSource) src).getReference().getVariable()));
            } else if (src instanceof CallSource) {
                CallSource call = (CallSource) src;
                out.add(FunctionSource.function(call.getFunction()));
                for (List<SourceDescriptor> arg : call.getInputs()) {
                    collectFunctionSources(arg, out);
                }
            }
        }
    }

    /**
     * 体记录的输入：变量版本与嵌套调用，字面量不作为输入
     */
    static List<BodyInput> bodyInputs(List<SourceDescriptor> sources) {
        Set<BodyInput> result = new LinkedHashSet<>();
        for (SourceDescriptor src : sources) {
            BodyInput input = toBodyInput(src);
            if (input != null) {
                result.add(input);
            }
        }
        return new ArrayList<>(result);
    }

    static BodyInput toBodyInput(SourceDescriptor src) {
        if (src instanceof VariableSource) {
            return new VariableInput(((VariableSource) src).getReference());
        }
        if (src instanceof CallSource) {
            CallSource call = (CallSource) src;
            List<SourceDescriptor> flattened = new ArrayList<>();
            for (List<SourceDescriptor> arg : call.getInputs()) {
                flattened.addAll(arg);
            }
            return new CallInput(call.getFunction(), bodyInputs(flattened));
        }
        return null;
    }

    /**
     * lambda 参数：引用到的全部变量名（含调用实参内），被调函数名不作为参数
     */
    static List<String> variableNames(List<SourceDescriptor> sources) {
        Set<String> result = new LinkedHashSet<>();
        collectVariableNames(sources, result);
        return new ArrayList<>(result);
    }

    private static void collectVariableNames(List<SourceDescriptor> sources, Set<String> out) {
        for (SourceDescriptor src : sources) {
            if (src instanceof VariableSource) {
                out.add(((VariableSource) src).getReference().getVariable());
            } else if (src instanceof CallSource) {
                for (List<SourceDescriptor> arg : ((CallSource) src).getInputs()) {
                    collectVariableNames(arg, out);
                }
            }
        }
    }
}
