package analysis.dataflow.interprocedural.pdg.serialization;

import java.io.Writer;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Graph elements that can be written as JSON
 */
public interface JSONSerializable {

    /**
     * @return JSON form of <code>this</code>
     */
    public JSONObject toJSON();

    /**
     * Write the JSON form of this object
     *
     * @param out
     *            writer to write to
     * @throws JSONException
     *             error writing to JSON
     */
    public void writeJSON(Writer out) throws JSONException;

}
