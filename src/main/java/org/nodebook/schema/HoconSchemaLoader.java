package org.nodebook.schema;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Loads a schema from HOCON.
 * <pre>
 * schema {
 *   node-types = [ { name = Animal }, { name = Dog, parents = [Animal] } ]
 *   relation-types = [ { name = eats, domain = [Animal], range = [] } ]
 *   attribute-types = [ { name = age, value-type = integer, scope = [Animal], unit = years } ]
 *   functions = [ { name = "age in months", expression = "age * 12", scope = [Animal] } ]
 * }
 * </pre>
 * Every list is optional. Relation types additionally accept {@code inverse},
 * {@code symmetric} and {@code transitive}; attribute types accept
 * {@code allowed-values}; all kinds accept {@code description}.
 */
public final class HoconSchemaLoader {

    private static final String ROOT = "schema";

    private HoconSchemaLoader() {
    }

    /**
     * Loads and parses a schema file.
     *
     * @throws SchemaException if the file is missing or malformed.
     */
    public static SchemaSnapshot load(File file) {
        if (!file.exists()) {
            throw new SchemaException("Schema file not found: " + file.getAbsolutePath());
        }
        try {
            return fromConfig(ConfigFactory.parseFile(file).resolve());
        } catch (ConfigException e) {
            throw new SchemaException("Failed to parse schema file " + file.getAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a schema from HOCON text.
     *
     * @throws SchemaException if the text is malformed.
     */
    public static SchemaSnapshot parse(String hocon) {
        try {
            return fromConfig(ConfigFactory.parseString(hocon).resolve());
        } catch (ConfigException e) {
            throw new SchemaException("Failed to parse schema: " + e.getMessage(), e);
        }
    }

    static SchemaSnapshot fromConfig(Config root) {
        Config schema = root.hasPath(ROOT) ? root.getConfig(ROOT) : root;
        List<SchemaDefinition> definitions = new ArrayList<>();

        for (Config c : configList(schema, "node-types")) {
            definitions.add(new NodeType(c.getString("name"), optString(c, "description"), optList(c, "parents")));
        }
        for (Config c : configList(schema, "relation-types")) {
            definitions.add(new RelationType(
                    c.getString("name"),
                    c.hasPath("inverse") ? c.getString("inverse") : null,
                    c.hasPath("symmetric") && c.getBoolean("symmetric"),
                    c.hasPath("transitive") && c.getBoolean("transitive"),
                    optList(c, "domain"),
                    optList(c, "range"),
                    optString(c, "description")));
        }
        for (Config c : configList(schema, "attribute-types")) {
            ValueType valueType;
            try {
                valueType = c.hasPath("value-type") ? ValueType.fromSchemaName(c.getString("value-type")) : ValueType.STRING;
            } catch (IllegalArgumentException e) {
                throw new SchemaException("Attribute type '" + c.getString("name")
                        + "' has unknown value-type '" + c.getString("value-type") + "'", e);
            }
            definitions.add(new AttributeType(
                    c.getString("name"),
                    valueType,
                    optList(c, "scope"),
                    optString(c, "description"),
                    c.hasPath("unit") ? c.getString("unit") : null,
                    optList(c, "allowed-values")));
        }
        for (Config c : configList(schema, "functions")) {
            definitions.add(new FunctionType(
                    c.getString("name"),
                    c.getString("expression"),
                    optList(c, "scope"),
                    optString(c, "description")));
        }
        return SchemaSnapshot.of(definitions);
    }

    private static List<? extends Config> configList(Config config, String path) {
        return config.hasPath(path) ? config.getConfigList(path) : List.of();
    }

    private static List<String> optList(Config config, String path) {
        return config.hasPath(path) ? config.getStringList(path) : List.of();
    }

    private static String optString(Config config, String path) {
        return config.hasPath(path) ? config.getString(path) : "";
    }
}
