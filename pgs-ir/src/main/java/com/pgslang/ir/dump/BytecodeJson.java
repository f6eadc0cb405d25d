package com.pgslang.ir.dump;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.pgslang.ir.bytecode.BytecodeProgram;
import com.pgslang.ir.bytecode.Chunk;
import com.pgslang.ir.bytecode.Instruction;
import com.pgslang.ir.bytecode.NativeBinding;
import pgs.runtime.PgsValue;
import pgs.runtime.StructLayout;
import pgs.runtime.ValueKind;

import java.util.List;

/**
 * 把编译产物导出为 JSON，供外部工具查看。
 */
public final class BytecodeJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    private BytecodeJson() {}

    public static String toJson(BytecodeProgram program) {
        return GSON.toJson(toJsonTree(program));
    }

    public static JsonObject toJsonTree(BytecodeProgram program) {
        JsonObject root = new JsonObject();

        JsonArray natives = new JsonArray();
        for (NativeBinding binding : program.getNatives()) {
            JsonObject n = new JsonObject();
            n.addProperty("name", binding.getName());
            n.add("params", types(binding.getParamKinds(), binding.getParamContainers()));
            n.addProperty("returns", binding.getReturnContainer() != null
                    ? binding.getReturnContainer() : binding.getReturnKind().getTypeName());
            natives.add(n);
        }
        root.add("natives", natives);

        JsonArray chunks = new JsonArray();
        for (Chunk chunk : program.getChunks()) {
            chunks.add(chunk(chunk));
        }
        root.add("chunks", chunks);
        return root;
    }

    private static JsonObject chunk(Chunk chunk) {
        JsonObject c = new JsonObject();
        c.addProperty("name", chunk.getName());
        c.add("params", types(chunk.getParamKinds(), chunk.getParamContainers()));
        c.addProperty("returns", chunk.getReturnTypeName());
        c.addProperty("locals", chunk.getLocalCount());

        JsonArray constants = new JsonArray();
        for (Object entry : chunk.getConstants().getEntries()) {
            constants.add(constant(entry));
        }
        c.add("constants", constants);

        JsonArray code = new JsonArray();
        for (Instruction inst : chunk.getInstructions()) {
            JsonObject i = new JsonObject();
            i.addProperty("op", inst.getOp().name());
            i.addProperty("a", inst.getA());
            i.addProperty("b", inst.getB());
            i.addProperty("line", inst.getLine());
            code.add(i);
        }
        c.add("code", code);
        return c;
    }

    private static JsonObject constant(Object entry) {
        JsonObject c = new JsonObject();
        if (entry instanceof StructLayout) {
            StructLayout layout = (StructLayout) entry;
            c.addProperty("kind", "layout");
            c.addProperty("name", layout.getName());
            JsonArray fields = new JsonArray();
            for (int i = 0; i < layout.getFieldCount(); i++) {
                JsonObject f = new JsonObject();
                f.addProperty("name", layout.getFieldNames().get(i));
                f.addProperty("type", layout.getFieldKinds().get(i).getTypeName());
                fields.add(f);
            }
            c.add("fields", fields);
            return c;
        }
        PgsValue value = (PgsValue) entry;
        c.addProperty("kind", value.getKind().getTypeName());
        switch (value.getKind()) {
            case INT:
                c.addProperty("value", value.asLong());
                break;
            case FLOAT:
                c.addProperty("value", value.asDouble());
                break;
            case STRING:
                c.addProperty("value", value.asString());
                break;
            case BOOL:
                c.addProperty("value", value.asBool());
                break;
            default:
                break;
        }
        return c;
    }

    /** 容器参数写全限定名，其余写种类名 */
    private static JsonArray types(List<ValueKind> kinds, List<String> containers) {
        JsonArray array = new JsonArray();
        for (int i = 0; i < kinds.size(); i++) {
            String container = containers.get(i);
            array.add(container != null ? container : kinds.get(i).getTypeName());
        }
        return array;
    }
}
