package analysis.ir.serialization;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import analysis.ir.AdtDef;
import analysis.ir.BasicBlock;
import analysis.ir.ClosureKind;
import analysis.ir.FieldDef;
import analysis.ir.InMemoryProgram;
import analysis.ir.LocalDecl;
import analysis.ir.Mutability;
import analysis.ir.Operand;
import analysis.ir.Place;
import analysis.ir.Procedure;
import analysis.ir.ProcedureId;
import analysis.ir.ProcedureKind;
import analysis.ir.ProcedureSignature;
import analysis.ir.Rvalue;
import analysis.ir.Statement;
import analysis.ir.Terminator;
import analysis.ir.Type;
import analysis.ir.VariantDef;
import analysis.ir.Visibility;

/**
 * Reads a program serialized as JSON into an {@link InMemoryProgram}. The
 * document has three optional arrays: <code>adts</code>,
 * <code>procedures</code> and <code>externals</code>. Places are written in
 * their printed form (<code>_1.*.0</code>), types as either a keyword
 * (<code>"int"</code>) or an object with a <code>kind</code>.
 */
public class ProgramJSONReader {

    /**
     * Algebraic data types by path, filled before anything else is read so
     * that types may refer to any of them
     */
    private final Map<String, AdtDef> adts = new LinkedHashMap<>();

    /**
     * Read a program from a file
     *
     * @param file
     *            JSON file
     * @return the program
     * @throws IOException
     *             if the file cannot be read
     */
    public static InMemoryProgram read(Path file) throws IOException {
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(r);
        }
    }

    /**
     * Read a program
     *
     * @param in
     *            JSON text
     * @return the program
     * @throws JSONException
     *             if the text is not well formed or a required key is missing
     * @throws IllegalArgumentException
     *             if the program is inconsistent, e.g. names an unknown type
     */
    public static InMemoryProgram read(Reader in) {
        return new ProgramJSONReader().readProgram(new JSONObject(new JSONTokener(in)));
    }

    /**
     * @return the algebraic data types read so far, by path
     */
    public Map<String, AdtDef> getAdts() {
        return adts;
    }

    /**
     * Read a program from a parsed document
     *
     * @param json
     *            document
     * @return the program
     */
    public InMemoryProgram readProgram(JSONObject json) {
        JSONArray adtArray = json.optJSONArray("adts");
        if (adtArray != null) {
            for (int i = 0; i < adtArray.length(); i++) {
                JSONObject a = adtArray.getJSONObject(i);
                String path = a.getString("path");
                if (adts.containsKey(path)) {
                    throw new IllegalArgumentException("Duplicate type " + path);
                }
                List<String> typeParams = readStrings(a.optJSONArray("typeParams"));
                adts.put(path, new AdtDef(path, a.optBoolean("enum", false), typeParams));
            }
            for (int i = 0; i < adtArray.length(); i++) {
                JSONObject a = adtArray.getJSONObject(i);
                AdtDef def = adts.get(a.getString("path"));
                JSONArray variants = a.getJSONArray("variants");
                for (int v = 0; v < variants.length(); v++) {
                    def.addVariant(readVariant(variants.getJSONObject(v)));
                }
            }
        }

        InMemoryProgram program = new InMemoryProgram();
        JSONArray procs = json.optJSONArray("procedures");
        if (procs != null) {
            for (int i = 0; i < procs.length(); i++) {
                program.add(readProcedure(procs.getJSONObject(i)));
            }
        }
        JSONArray externals = json.optJSONArray("externals");
        if (externals != null) {
            for (int i = 0; i < externals.length(); i++) {
                JSONObject e = externals.getJSONObject(i);
                program.addExternal(new ProcedureSignature(ProcedureId.parse(e.getString("id")),
                                                           readStrings(e.optJSONArray("typeParams")),
                                                           readTypes(e.optJSONArray("params")),
                                                           readType(e.get("returns"))));
            }
        }
        return program;
    }

    private VariantDef readVariant(JSONObject v) {
        List<FieldDef> fields = new ArrayList<>();
        JSONArray fs = v.optJSONArray("fields");
        if (fs != null) {
            for (int i = 0; i < fs.length(); i++) {
                JSONObject f = fs.getJSONObject(i);
                String vis = f.optString("visibility", "pub");
                fields.add(new FieldDef(f.optString("name", Integer.toString(i)), readType(f.get("type")), "pub"
                        .equals(vis) ? Visibility.PUBLIC : Visibility.restricted(vis)));
            }
        }
        return new VariantDef(v.getString("name"), fields);
    }

    /**
     * Read one procedure body
     *
     * @param p
     *            serialized procedure
     * @return the procedure
     */
    public Procedure readProcedure(JSONObject p) {
        ProcedureId id = ProcedureId.parse(p.getString("id"));
        ProcedureKind kind = ProcedureKind.valueOf(p.optString("kind", "FN"));
        List<LocalDecl> locals = new ArrayList<>();
        JSONArray ls = p.getJSONArray("locals");
        for (int i = 0; i < ls.length(); i++) {
            JSONObject l = ls.getJSONObject(i);
            locals.add(new LocalDecl(readType(l.get("type")), l.optString("name", "_" + i)));
        }
        List<BasicBlock> blocks = new ArrayList<>();
        JSONArray bs = p.getJSONArray("blocks");
        for (int b = 0; b < bs.length(); b++) {
            JSONObject block = bs.getJSONObject(b);
            List<Statement> stmts = new ArrayList<>();
            JSONArray ss = block.optJSONArray("statements");
            if (ss != null) {
                for (int s = 0; s < ss.length(); s++) {
                    stmts.add(readStatement(ss.getJSONObject(s)));
                }
            }
            blocks.add(new BasicBlock(stmts, readTerminator(block.getJSONObject("terminator"))));
        }
        return new Procedure(id, kind, p.getInt("argCount"), readStrings(p.optJSONArray("typeParams")), locals,
                             blocks, p.optBoolean("unsafe", false));
    }

    private Statement readStatement(JSONObject s) {
        String kind = s.getString("kind");
        switch (kind) {
        case "assign":
            return Statement.assign(place(s, "place"), readRvalue(s.getJSONObject("rvalue")));
        case "setDiscriminant":
            return Statement.setDiscriminant(place(s, "place"), s.getInt("variant"));
        case "storageLive":
            return Statement.storageLive(s.getInt("local"));
        case "storageDead":
            return Statement.storageDead(s.getInt("local"));
        case "nop":
            return Statement.nop();
        default:
            throw new IllegalArgumentException("Unknown statement kind " + kind);
        }
    }

    private Rvalue readRvalue(JSONObject r) {
        String kind = r.getString("kind");
        switch (kind) {
        case "use":
            return Rvalue.use(readOperand(r.getJSONObject("op")));
        case "ref":
            return Rvalue.ref(mutability(r), place(r, "place"));
        case "addressOf":
            return Rvalue.addressOf(mutability(r), place(r, "place"));
        case "binary":
            JSONArray ops = r.getJSONArray("ops");
            return Rvalue.binary(r.optString("operator", "+"), readOperand(ops.getJSONObject(0)),
                                 readOperand(ops.getJSONObject(1)));
        case "unary":
            return Rvalue.unary(r.optString("operator", "-"), readOperand(r.getJSONObject("op")));
        case "cast":
            return Rvalue.cast(readOperand(r.getJSONObject("op")), readType(r.get("type")));
        case "aggregate":
            return Rvalue.aggregate(readType(r.get("type")), r.optInt("variant", 0), readOperands(r
                    .optJSONArray("ops")));
        case "discriminant":
            return Rvalue.discriminant(place(r, "place"));
        case "len":
            return Rvalue.len(place(r, "place"));
        case "repeat":
            return Rvalue.repeat(readOperand(r.getJSONObject("op")), readType(r.get("type")));
        default:
            throw new IllegalArgumentException("Unknown rvalue kind " + kind);
        }
    }

    private Terminator readTerminator(JSONObject t) {
        String kind = t.getString("kind");
        switch (kind) {
        case "goto":
            return Terminator.jump(t.getInt("target"));
        case "switchInt":
            List<Integer> targets = new ArrayList<>();
            JSONArray ts = t.getJSONArray("targets");
            for (int i = 0; i < ts.length(); i++) {
                targets.add(ts.getInt(i));
            }
            return Terminator.switchInt(readOperand(t.getJSONObject("discr")), targets);
        case "return":
            return Terminator.ret();
        case "unreachable":
            return Terminator.unreachable();
        case "drop":
            return Terminator.drop(place(t, "place"), t.getInt("target"));
        case "call":
            Integer target = t.isNull("target") ? null : t.getInt("target");
            Integer cleanup = t.isNull("cleanup") ? null : t.getInt("cleanup");
            return Terminator.call(readOperand(t.getJSONObject("func")), readOperands(t.optJSONArray("args")),
                                   place(t, "dest"), target, cleanup);
        default:
            throw new IllegalArgumentException("Unknown terminator kind " + kind);
        }
    }

    private List<Operand> readOperands(JSONArray a) {
        List<Operand> l = new ArrayList<>();
        if (a != null) {
            for (int i = 0; i < a.length(); i++) {
                l.add(readOperand(a.getJSONObject(i)));
            }
        }
        return l;
    }

    /**
     * One of <code>{"copy": place}</code>, <code>{"move": place}</code>,
     * <code>{"const": type, "value": text}</code> or
     * <code>{"fn": id, "args": [types], "dynamic": bool}</code>
     */
    private Operand readOperand(JSONObject o) {
        if (o.has("copy")) {
            return Operand.copy(Place.parse(o.getString("copy")));
        }
        if (o.has("move")) {
            return Operand.move(Place.parse(o.getString("move")));
        }
        if (o.has("const")) {
            return Operand.constant(o.optString("value", "_"), readType(o.get("const")));
        }
        if (o.has("fn")) {
            ProcedureId fn = ProcedureId.parse(o.getString("fn"));
            if (o.optBoolean("dynamic", false)) {
                return Operand.dynamicFunction(fn);
            }
            return Operand.function(fn, readTypes(o.optJSONArray("args")));
        }
        throw new IllegalArgumentException("Unknown operand " + o);
    }

    private static Place place(JSONObject o, String key) {
        return Place.parse(o.getString(key));
    }

    private static Mutability mutability(JSONObject o) {
        return o.optBoolean("mut", false) ? Mutability.MUT : Mutability.NOT;
    }

    private List<Type> readTypes(JSONArray a) {
        List<Type> l = new ArrayList<>();
        if (a != null) {
            for (int i = 0; i < a.length(); i++) {
                l.add(readType(a.get(i)));
            }
        }
        return l;
    }

    /**
     * Read a type, either a keyword or an object with a <code>kind</code>
     *
     * @param json
     *            a {@link String} or a {@link JSONObject}
     * @return the type
     */
    public Type readType(Object json) {
        if (json instanceof String) {
            String name = (String) json;
            switch (name) {
            case "unit":
                return Type.unit();
            case "never":
                return Type.never();
            case "bool":
                return Type.bool();
            case "int":
                return Type.integer();
            case "float":
                return Type.floating();
            case "str":
                return Type.str();
            default:
                throw new IllegalArgumentException("Unknown type " + name);
            }
        }
        if (!(json instanceof JSONObject)) {
            throw new IllegalArgumentException("Not a type: " + json);
        }
        JSONObject t = (JSONObject) json;
        String kind = t.getString("kind");
        switch (kind) {
        case "adt":
            AdtDef def = adts.get(t.getString("path"));
            if (def == null) {
                throw new IllegalArgumentException("Unknown type " + t.getString("path"));
            }
            return Type.adt(def, readTypes(t.optJSONArray("args")));
        case "tuple":
            return Type.tuple(readTypes(t.optJSONArray("elems")));
        case "ref":
            return Type.ref(mutability(t), readType(t.get("inner")));
        case "ptr":
            return Type.rawPtr(mutability(t), readType(t.get("inner")));
        case "box":
            return Type.box(readType(t.get("inner")));
        case "array":
            return Type.array(readType(t.get("inner")));
        case "slice":
            return Type.slice(readType(t.get("inner")));
        case "closure":
            return Type.closure(ProcedureId.parse(t.getString("body")), ClosureKind.valueOf(t.optString("closureKind",
                                                                                                       "FN")),
                                readTypes(t.optJSONArray("upvars")));
        case "fn":
            return Type.fnDef(ProcedureId.parse(t.getString("id")), readTypes(t.optJSONArray("args")));
        case "param":
            return Type.param(t.getString("name"));
        case "dyn":
            return Type.dynamic(t.getString("trait"));
        default:
            return readType(kind);
        }
    }

    private static List<String> readStrings(JSONArray a) {
        List<String> l = new ArrayList<>();
        if (a != null) {
            for (int i = 0; i < a.length(); i++) {
                l.add(a.getString(i));
            }
        }
        return l;
    }
}
