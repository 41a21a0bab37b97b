package com.tracechain.anchoring;

import com.tracechain.anchoring.config.AnchoringProperties;
import com.tracechain.domain.EntityKind;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads shipments, shipment events and documents from the CRUD layer's collections. Every query carries a
 * server-side {@code maxTime}, so a slow database fails the lookup instead of blocking the caller.
 */
@Component
@RequiredArgsConstructor
public class MongoAnchorTargetLookup implements AnchorTargetLookup {

    private final MongoTemplate mongoTemplate;
    private final AnchoringProperties properties;
    private final Clock clock;

    @Override
    public Optional<AnchorTarget> lookup(EntityKind entityKind, String entityId) {
        return switch (entityKind) {
            case SHIPMENT -> findById(properties.getCollections().getShipments(), entityId).map(this::shipment);
            case EVENT -> findById(properties.getCollections().getEvents(), entityId).flatMap(this::event);
            case DOCUMENT -> findById(properties.getCollections().getDocuments(), entityId).map(this::document);
        };
    }

    private AnchorTarget shipment(Document doc) {
        String id = idOf(doc);
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("shipment_id", id);
        input.put("tracking_number", doc.getString("trackingNumber"));
        input.put("organization_id", doc.getString("organizationId"));
        input.put("status", doc.getString("status"));
        input.put("created_at", iso(doc.get("createdAt")));
        input.put("origin", doc.getString("origin"));
        input.put("destination", doc.getString("destination"));
        input.put("timestamp", clock.instant().toString());
        return new AnchorTarget(EntityKind.SHIPMENT, id, id, doc.getString("trackingNumber"), null, null, input);
    }

    private Optional<AnchorTarget> event(Document doc) {
        String shipmentId = doc.getString("shipmentId");
        return findById(properties.getCollections().getShipments(), shipmentId).map(shipment -> {
            String id = idOf(doc);
            Map<String, Object> input = new LinkedHashMap<>();
            input.put("event_id", id);
            input.put("shipment_id", shipmentId);
            input.put("tracking_number", shipment.getString("trackingNumber"));
            input.put("event_type", doc.getString("eventType"));
            input.put("timestamp", iso(doc.get("timestamp")));
            input.put("location", doc.getString("location"));
            input.put("latitude", doc.get("latitude"));
            input.put("longitude", doc.get("longitude"));
            input.put("description", doc.getString("description"));
            input.put("source", doc.getString("source"));
            input.put("created_at", iso(doc.get("createdAt")));
            input.put("verification_timestamp", clock.instant().toString());
            for (String sensor : new String[]{"temperature", "humidity", "shock"}) {
                if (doc.get(sensor) != null) {
                    input.put(sensor, doc.get(sensor));
                }
            }
            return new AnchorTarget(EntityKind.EVENT, id, shipmentId, shipment.getString("trackingNumber"),
                    doc.getString("eventType"), null, input);
        });
    }

    private AnchorTarget document(Document doc) {
        String id = idOf(doc);
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("document_id", id);
        input.put("shipment_id", doc.getString("shipmentId"));
        input.put("filename", doc.getString("filename"));
        input.put("document_type", doc.getString("documentType"));
        input.put("content_hash", doc.getString("contentHash"));
        return new AnchorTarget(EntityKind.DOCUMENT, id, doc.getString("shipmentId"), null, null,
                doc.getString("contentHash"), input);
    }

    private Optional<Document> findById(String collection, String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        Query query = Query.query(Criteria.where("_id").is(id))
                .maxTime(Duration.ofMillis(properties.getLookupTimeoutMs()));
        return Optional.ofNullable(mongoTemplate.findOne(query, Document.class, collection));
    }

    private static String idOf(Document doc) {
        Object id = doc.get("_id");
        return id == null ? null : id.toString();
    }

    private static String iso(Object value) {
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        return value == null ? null : value.toString();
    }
}
