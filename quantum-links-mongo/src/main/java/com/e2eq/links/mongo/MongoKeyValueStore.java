package com.e2eq.links.mongo;

import com.e2eq.links.core.KeyValueStore;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.UpdateResult;
import io.quarkus.logging.Log;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.*;
import java.util.regex.Pattern;

/**
 * {@link KeyValueStore} over a single MongoDB collection. Scalars are stored as
 * {@code {_id: key, value: "..."}}, sets as {@code {_id: key, members: [...]}} maintained with
 * {@code $addToSet}/{@code $pull}, which keeps insertion order. Replaces the in-memory default
 * store when this module is on the classpath.
 */
@ApplicationScoped
public class MongoKeyValueStore implements KeyValueStore {

    static final String ID = "_id";
    static final String VALUE = "value";
    static final String MEMBERS = "members";

    private MongoCollection<Document> kv;

    @Inject
    MongoClient mongoClient;

    @ConfigProperty(name = "quarkus.mongodb.database")
    String databaseName;

    @ConfigProperty(name = "quantum.links.mongo.collection", defaultValue = "links_kv")
    String collectionName;

    public MongoKeyValueStore() { }

    MongoKeyValueStore(MongoCollection<Document> collection) {
        this.kv = collection;
    }

    @PostConstruct
    void init() {
        this.kv = mongoClient.getDatabase(databaseName).getCollection(collectionName);
        Log.infof("Link store using MongoDB collection %s.%s", databaseName, collectionName);
    }

    @Override
    public Optional<String> get(String key) {
        Document d = kv.find(Filters.eq(ID, key)).first();
        return Optional.ofNullable(d).map(doc -> doc.getString(VALUE));
    }

    @Override
    public void set(String key, String value) {
        kv.replaceOne(Filters.eq(ID, key), valueDocument(key, value), new ReplaceOptions().upsert(true));
    }

    @Override
    public boolean setIfAbsent(String key, String value) {
        UpdateResult r = kv.updateOne(Filters.eq(ID, key), Updates.setOnInsert(VALUE, value),
                new UpdateOptions().upsert(true));
        return r.getUpsertedId() != null;
    }

    @Override
    public boolean delete(String key) {
        return kv.deleteOne(Filters.eq(ID, key)).getDeletedCount() > 0;
    }

    @Override
    public Map<String, String> mGet(List<String> keys) {
        if (keys == null || keys.isEmpty()) return Map.of();
        Map<String, String> found = new HashMap<>();
        for (Document d : kv.find(Filters.in(ID, keys))) {
            String v = d.getString(VALUE);
            if (v != null) found.put(d.getString(ID), v);
        }
        return inRequestOrder(keys, found);
    }

    @Override
    public boolean sAdd(String key, String member) {
        UpdateResult r = kv.updateOne(Filters.eq(ID, key), Updates.addToSet(MEMBERS, member),
                new UpdateOptions().upsert(true));
        return r.getUpsertedId() != null || r.getModifiedCount() > 0;
    }

    @Override
    public boolean sRem(String key, String member) {
        UpdateResult r = kv.updateOne(Filters.eq(ID, key), Updates.pull(MEMBERS, member));
        if (r.getModifiedCount() == 0) return false;
        kv.deleteOne(emptySetFilter(key));
        return true;
    }

    @Override
    public List<String> sMembers(String key) {
        Document d = kv.find(Filters.eq(ID, key)).projection(Projections.include(MEMBERS)).first();
        return membersOf(d);
    }

    @Override
    public List<String> keys(String prefix) {
        List<String> out = new ArrayList<>();
        for (Document d : kv.find(prefixFilter(prefix)).projection(Projections.include(ID)).sort(Sorts.ascending(ID))) {
            out.add(d.getString(ID));
        }
        return out;
    }

    static Document valueDocument(String key, String value) {
        return new Document(ID, key).append(VALUE, value);
    }

    static List<String> membersOf(Document d) {
        if (d == null) return List.of();
        List<String> members = d.getList(MEMBERS, String.class);
        return members == null ? List.of() : List.copyOf(members);
    }

    static String prefixRegex(String prefix) {
        return "^" + Pattern.quote(prefix == null ? "" : prefix);
    }

    static Bson prefixFilter(String prefix) {
        return Filters.regex(ID, prefixRegex(prefix));
    }

    static Bson emptySetFilter(String key) {
        return Filters.and(Filters.eq(ID, key), Filters.size(MEMBERS, 0));
    }

    static Map<String, String> inRequestOrder(List<String> keys, Map<String, String> found) {
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String k : keys) {
            String v = found.get(k);
            if (v != null) ordered.putIfAbsent(k, v);
        }
        return ordered;
    }
}
