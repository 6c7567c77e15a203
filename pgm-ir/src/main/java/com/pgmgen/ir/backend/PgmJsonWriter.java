package com.pgmgen.ir.backend;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.pgmgen.ir.pgm.*;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * PGM 文档的 JSON 序列化。
 *
 * <p>字段顺序固定为 {@code start, name, dateCreated, functions, body}；
 * 无输出的体记录写作空对象 {@code "output": {}}。</p>
 */
public class PgmJsonWriter {

    private final Gson gson;

    public PgmJsonWriter() {
        this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    }

    public String toJson(PgmDocument document) {
        return gson.toJson(toJsonTree(document));
    }

    public void write(PgmDocument document, Writer writer) throws IOException {
        gson.toJson(toJsonTree(document), writer);
        writer.flush();
    }

    public void write(PgmDocument document, File file) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }
        try (Writer writer = new OutputStreamWriter(Files.newOutputStream(file.toPath()), StandardCharsets.UTF_8)) {
            write(document, writer);
        }
    }

    public JsonObject toJsonTree(PgmDocument document) {
        JsonObject root = new JsonObject();
        root.addProperty("start", document.getStart());
        root.addProperty("name", document.getName());
        root.addProperty("dateCreated", document.getDateCreated());
        JsonArray functions = new JsonArray();
        for (PgmFunction function : document.getFunctions()) {
            functions.add(function(function));
        }
        root.add("functions", functions);
        root.add("body", records(document.getBody()));
        return root;
    }

    // ============ 函数 ============

    private JsonObject function(PgmFunction function) {
        switch (function.getKind()) {
            case ASSIGN:
                return assign((AssignFunction) function);
            case DECISION:
                return decision((DecisionFunction) function);
            case CONTAINER:
                return container((ContainerFunction) function);
            case LOOP_PLATE:
                return loopPlate((LoopPlateFunction) function);
            default:
                throw new IllegalArgumentException("Unknown function kind: " + function.getKind());
        }
    }

    private JsonObject assign(AssignFunction function) {
        JsonObject obj = header(function);
        obj.addProperty("target", function.getTarget());
        JsonArray sources = new JsonArray();
        for (FunctionSource source : function.getSources()) {
            JsonObject src = new JsonObject();
            src.addProperty("name", source.getName());
            src.addProperty("type", source.getType().getJsonName());
            sources.add(src);
        }
        obj.add("sources", sources);

        FunctionBody body = function.getBody();
        if (body instanceof LiteralBody) {
            LiteralBody literal = (LiteralBody) body;
            JsonObject payload = new JsonObject();
            payload.addProperty("type", "literal");
            payload.addProperty("dtype", literal.getDtype().getJsonName());
            payload.addProperty("value", literal.getValue());
            obj.add("body", payload);
        } else {
            LambdaBody lambda = (LambdaBody) body;
            JsonObject ref = new JsonObject();
            ref.addProperty("type", "lambda");
            ref.addProperty("name", lambda.getName());
            ref.addProperty("reference", lambda.getReference());
            JsonArray array = new JsonArray();
            array.add(ref);
            obj.add("body", array);
        }
        return obj;
    }

    private JsonObject decision(DecisionFunction function) {
        JsonObject obj = header(function);
        obj.addProperty("target", function.getTarget());
        JsonArray sources = new JsonArray();
        for (VariableReference input : function.getInputs()) {
            JsonObject src = new JsonObject();
            src.addProperty("name", input.getVersionedName());
            src.addProperty("type", FunctionSource.SourceType.VARIABLE.getJsonName());
            sources.add(src);
        }
        obj.add("sources", sources);
        return obj;
    }

    private JsonObject container(ContainerFunction function) {
        JsonObject obj = header(function);
        obj.add("input", typedVariables(function.getInput()));
        obj.add("variables", typedVariables(function.getVariables()));
        obj.add("body", records(function.getBody()));
        return obj;
    }

    private JsonObject loopPlate(LoopPlateFunction function) {
        JsonObject obj = header(function);
        JsonArray input = new JsonArray();
        for (String name : function.getInput()) {
            input.add(name);
        }
        obj.add("input", input);
        obj.addProperty("index_variable", function.getIndexVariable());
        JsonObject range = new JsonObject();
        range.add("start", rangeBound(function.getRange().getStart()));
        range.add("end", rangeBound(function.getRange().getEnd()));
        obj.add("index_iteration_range", range);
        obj.add("body", records(function.getBody()));
        return obj;
    }

    private static JsonObject header(PgmFunction function) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", function.getName());
        obj.addProperty("type", function.getKind().getJsonName());
        return obj;
    }

    private static JsonArray typedVariables(List<TypedVariable> variables) {
        JsonArray array = new JsonArray();
        for (TypedVariable variable : variables) {
            JsonObject obj = new JsonObject();
            obj.addProperty("name", variable.getName());
            if (variable.hasDomain()) {
                obj.addProperty("domain", variable.getDomain().getJsonName());
            }
            array.add(obj);
        }
        return array;
    }

    private static JsonObject rangeBound(SourceDescriptor bound) {
        JsonObject obj = new JsonObject();
        if (bound instanceof LiteralSource) {
            LiteralSource literal = (LiteralSource) bound;
            obj.addProperty("type", "literal");
            obj.addProperty("dtype", literal.getDomain().getJsonName());
            obj.addProperty("value", literal.getText());
        } else {
            VariableReference ref = ((VariableSource) bound).getReference();
            obj.addProperty("variable", ref.getVariable());
            obj.addProperty("index", ref.getIndex());
        }
        return obj;
    }

    // ============ 体记录 ============

    private static JsonArray records(List<BodyRecord> records) {
        JsonArray array = new JsonArray();
        for (BodyRecord record : records) {
            JsonObject obj = new JsonObject();
            obj.addProperty(record.isExternal() ? "function" : "name", record.getName());
            obj.add("output", record.hasOutput() ? reference(record.getOutput()) : new JsonObject());
            obj.add("input", inputs(record.getInput()));
            array.add(obj);
        }
        return array;
    }

    private static JsonArray inputs(List<BodyInput> inputs) {
        JsonArray array = new JsonArray();
        for (BodyInput input : inputs) {
            if (input instanceof VariableInput) {
                array.add(reference(((VariableInput) input).getReference()));
            } else {
                CallInput call = (CallInput) input;
                JsonObject inner = new JsonObject();
                inner.addProperty("function", call.getFunction());
                inner.add("input", inputs(call.getInput()));
                JsonObject obj = new JsonObject();
                obj.add("call", inner);
                array.add(obj);
            }
        }
        return array;
    }

    private static JsonObject reference(VariableReference ref) {
        JsonObject obj = new JsonObject();
        obj.addProperty("variable", ref.getVariable());
        obj.addProperty("index", ref.getIndex());
        return obj;
    }
}
