/**
 *
 */
package org.theseed.rba.model;

import java.util.Collection;
import java.util.Map;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This is the base class for the nine parts of an RBA model.  Each part keeps its entities in
 * insertion-ordered maps keyed on ID, and no two entities in the same list may share an ID.
 */
public abstract class SubModel {

    /**
     * @return the name of this sub-model (used for file names and messages)
     */
    public abstract String getName();

    /**
     * @return a JSON object describing this sub-model
     */
    public abstract JsonObject toJson();

    /**
     * Add an entity to an ID map, insuring the ID is not already in use.
     *
     * @param map		map of IDs to entities
     * @param id		ID of the new entity
     * @param item		entity to add
     * @param type		type of entity (for the error message)
     *
     * @throws IllegalArgumentException		if the ID is already present
     */
    protected <T> void addUnique(Map<String, T> map, String id, T item, String type) {
        if (map.containsKey(id))
            throw new IllegalArgumentException("Duplicate " + type + " ID \"" + id + "\" in " + this.getName() + ".");
        map.put(id, item);
    }

    /**
     * This interface is used by all the entities that can be converted to JSON.
     */
    public interface IJsonItem {

        /**
         * @return a JSON object describing this entity
         */
        public JsonObject toJson();

    }

    /**
     * @return a JSON array containing the specified entities
     *
     * @param items		entities to convert
     */
    protected static JsonArray toJsonArray(Collection<? extends IJsonItem> items) {
        JsonArray retVal = new JsonArray();
        for (IJsonItem item : items)
            retVal.add(item.toJson());
        return retVal;
    }

}
