package com.aiprofessor.simulation.infrastructure.persistence;

import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import org.bson.Document;
import org.bson.types.ObjectId;

/** Conversions shared by the Mongo adapters. */
final class MongoDocuments {

    static final String ID = "_id";

    private MongoDocuments() {
        // utility class
    }

    static Optional<ObjectId> objectId(String id) {
        return id != null && ObjectId.isValid(id) ? Optional.of(new ObjectId(id)) : Optional.empty();
    }

    static String id(Document document) {
        Object id = document.get(ID);
        if (id instanceof ObjectId) {
            return ((ObjectId) id).toHexString();
        }
        return id == null ? null : id.toString();
    }

    static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    static Instant instant(Document document, String field) {
        Date date = document.getDate(field);
        return date == null ? null : date.toInstant();
    }

    static int intValue(Document document, String field) {
        Number number = document.get(field, Number.class);
        return number == null ? 0 : number.intValue();
    }

    static Long longValue(Document document, String field) {
        Number number = document.get(field, Number.class);
        return number == null ? null : number.longValue();
    }
}
