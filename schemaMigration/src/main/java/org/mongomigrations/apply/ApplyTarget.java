package org.mongomigrations.apply;

/**
 * One destination object the generated script creates (or deliberately skips).
 * Names are the destination names, i.e. with the database prefix applied.
 */
public record ApplyTarget(
    Type type,
    String database,
    String collection,
    String index
) {

    public enum Type {
        DATABASE,
        COLLECTION,
        SHARD_COLLECTION,
        INDEX
    }

    public static ApplyTarget database(String database) {
        return new ApplyTarget(Type.DATABASE, database, null, null);
    }

    public static ApplyTarget collection(String database, String collection) {
        return new ApplyTarget(Type.COLLECTION, database, collection, null);
    }

    public static ApplyTarget shardCollection(String database, String collection) {
        return new ApplyTarget(Type.SHARD_COLLECTION, database, collection, null);
    }

    public static ApplyTarget index(String database, String collection, String index) {
        return new ApplyTarget(Type.INDEX, database, collection, index);
    }

    public String describe() {
        var sb = new StringBuilder(database);
        if (collection != null) {
            sb.append('.').append(collection);
        }
        if (index != null) {
            sb.append(" [").append(index).append(']');
        }
        if (type == Type.SHARD_COLLECTION) {
            sb.append(" (shard)");
        }
        return sb.toString();
    }
}
