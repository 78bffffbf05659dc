package analysis.dataflow.interprocedural.pdg.graph;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

import analysis.dataflow.interprocedural.infoflow.MutationReason;
import analysis.dataflow.interprocedural.pdg.serialization.JSONSerializable;
import analysis.dataflow.interprocedural.pdg.serialization.JSONUtil;
import analysis.ir.Place;

/**
 * Directed edge in the dependence graph
 */
public final class DependenceEdge implements JSONSerializable {

    private final GraphLocation source;
    private final GraphLocation target;
    private final DependenceEdgeType type;
    /**
     * Place written at the target, null for call and return edges
     */
    private final Place place;
    /**
     * Why the place was written, null for call and return edges
     */
    private final MutationReason reason;
    /**
     * Call site the edge crosses, null for data and control edges
     */
    private final CallSiteLabel label;

    /**
     * Create an edge between two program points
     *
     * @param source
     *            source of the edge
     * @param target
     *            target of the edge
     * @param type
     *            type of edge
     * @param place
     *            place written at the target, may be null
     * @param reason
     *            reason for the write, may be null
     * @param label
     *            call site the edge crosses, may be null
     */
    public DependenceEdge(GraphLocation source, GraphLocation target, DependenceEdgeType type, Place place,
                          MutationReason reason, CallSiteLabel label) {
        assert source != null : "Null source for edge to " + target + " of type " + type;
        assert target != null : "Null target for edge from " + source + " of type " + type;
        this.source = source;
        this.target = target;
        this.type = type;
        this.place = place;
        this.reason = reason;
        this.label = label;
    }

    public GraphLocation getSource() {
        return source;
    }

    public GraphLocation getTarget() {
        return target;
    }

    public DependenceEdgeType getType() {
        return type;
    }

    public Place getPlace() {
        return place;
    }

    public MutationReason getReason() {
        return reason;
    }

    public CallSiteLabel getLabel() {
        return label;
    }

    /**
     * @return text used to label the edge in dot output
     */
    String dotLabel() {
        StringBuilder sb = new StringBuilder(type.shortName());
        if (place != null) {
            sb.append(" ").append(place);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return source + " -> " + target + " [" + type + "]" + (place != null ? (" [" + place + "]") : "");
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((label == null) ? 0 : label.hashCode());
        result = prime * result + ((place == null) ? 0 : place.hashCode());
        result = prime * result + ((reason == null) ? 0 : reason.hashCode());
        result = prime * result + source.hashCode();
        result = prime * result + target.hashCode();
        result = prime * result + type.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        DependenceEdge other = (DependenceEdge) obj;
        if (label != other.label) {
            return false;
        }
        if (place == null ? other.place != null : !place.equals(other.place)) {
            return false;
        }
        if (reason == null ? other.reason != null : !reason.equals(other.reason)) {
            return false;
        }
        return type == other.type && source.equals(other.source) && target.equals(other.target);
    }

    @Override
    public JSONObject toJSON() {
        JSONObject json = new JSONObject();
        try {
            json.put("source", JSONUtil.toJSON(source));
            json.put("dest", JSONUtil.toJSON(target));
            json.put("type", type.toString());
            if (place != null) {
                JSONUtil.addJSON(json, "place", place.toString());
            }
            if (reason != null) {
                JSONUtil.addJSON(json, "reason", reason.toString());
            }
            JSONUtil.addJSON(json, label);
        }
        catch (JSONException e) {
            throw new RuntimeException("Serialization error for edge " + this + ", message: " + e.getMessage(), e);
        }
        return json;
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }
}
