package analysis.dataflow.interprocedural.pdg.serialization;

import java.util.Map;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import analysis.dataflow.interprocedural.pdg.graph.CallSiteLabel;
import analysis.dataflow.interprocedural.pdg.graph.GraphLocation;
import analysis.dataflow.interprocedural.pdg.graph.node.DependenceNodeKey;
import analysis.dataflow.interprocedural.pdg.graph.node.ProcedureNode;
import analysis.ir.Type;

public class JSONUtil {

    /**
     * Serialize the given {@link ProcedureNode}
     *
     * @param n
     *            node to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(ProcedureNode n) {
        JSONObject json = new JSONObject();
        DependenceNodeKey key = n.getKey();
        json.put("nodeid", n.getId());
        addJSON(json, "procedure", key.getProcedure().toString());
        JSONArray inst = new JSONArray();
        for (Type t : key.getInstantiation()) {
            inst.put(t.toString());
        }
        json.put("instantiation", inst);
        addJSON(json, "context", key.getContext().toString());
        addJSON(json, "analyzed", n.isAnalyzed());
        return json;
    }

    /**
     * Serialize a program point as the id of its node and its location
     *
     * @param l
     *            program point
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(GraphLocation l) {
        JSONObject json = new JSONObject();
        json.put("nodeid", l.getNode().getId());
        addJSON(json, "location", l.getLocation().toString());
        return json;
    }

    /**
     * Add a call site label to the given {@link JSONObject}. The existing
     * {@link JSONObject} will be modified.
     *
     * @param json
     *            The label will be added to this
     * @param label
     *            label to add, nothing is added if it is null
     */
    public static void addJSON(JSONObject json, CallSiteLabel label) {
        if (label == null) {
            return;
        }
        JSONObject labelJson = new JSONObject();
        addJSON(labelJson, "callee", String.valueOf(label.getCallee()));
        addJSON(labelJson, "outcome", label.getOutcome().toString());
        addJSON(labelJson, "unwrapped", label.isUnwrapped());
        if (!label.getMetadata().isEmpty()) {
            JSONObject meta = new JSONObject();
            for (Map.Entry<String, String> e : label.getMetadata().entrySet()) {
                addJSON(meta, e.getKey(), e.getValue());
            }
            labelJson.put("metadata", meta);
        }
        json.put("label", labelJson);
    }

    /**
     * Add the (key,value) pair to the given JSONObject. The existing
     * {@link JSONObject} will be modified.
     *
     * @param json
     *            the (key,value) pair will be added to this
     * @param key
     *            key for the new JSON entry
     * @param value
     *            string value to add to the JSON object
     */
    public static void addJSON(JSONObject json, String key, String value) {
        try {
            json.put(key, value);
        }
        catch (JSONException e) {
            throw new RuntimeException("Serialization error for (" + key + ", " + value + "), message: "
                    + e.getMessage(), e);
        }
    }

    /**
     * Add the (key,value) pair to the given JSONObject. The existing
     * {@link JSONObject} will be modified.
     *
     * @param json
     *            the (key,value) pair will be added to this
     * @param key
     *            key for the new JSON entry
     * @param value
     *            boolean value to add to the JSON object
     */
    public static void addJSON(JSONObject json, String key, boolean value) {
        try {
            json.put(key, value);
        }
        catch (JSONException e) {
            throw new RuntimeException("Serialization error for (" + key + ", " + value + "), message: "
                    + e.getMessage(), e);
        }
    }
}
