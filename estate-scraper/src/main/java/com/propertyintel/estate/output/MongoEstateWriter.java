package com.propertyintel.estate.output;

import com.mongodb.client.result.UpdateResult;
import com.propertyintel.estate.config.EstateScraperProperties;
import com.propertyintel.estate.config.EstateScraperProperties.Output.OutputMode;
import com.propertyintel.estate.model.EstateItem;
import com.propertyintel.estate.model.UpsertResult;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Writes estate items to a MongoDB collection with one atomic
 * upsert-by-hash_id per item, so no separate existence check is needed.
 */
@Component
@Slf4j
public class MongoEstateWriter implements PersistenceAdapter {

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public MongoEstateWriter(MongoTemplate mongoTemplate, EstateScraperProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.collection = properties.getOutput().getDocument().getCollection();
    }

    @Override
    public OutputMode mode() {
        return OutputMode.DOCUMENT;
    }

    @Override
    public void open() {
        try {
            mongoTemplate.executeCommand("{ ping: 1 }");
        } catch (Exception e) {
            throw new PersistenceException("MongoDB is not reachable: " + e.getMessage(), e);
        }

        // sparse: listings without a hash_id may still be stored, each as its own document
        mongoTemplate.indexOps(collection).ensureIndex(new Index()
                .on(EstateItem.ID_FIELD, Sort.Direction.ASC)
                .unique()
                .sparse()
                .named("hash_id_unique"));
        log.info("MongoDB collection {} ready", collection);
    }

    @Override
    public UpsertResult upsert(EstateItem item) {
        Object id = item.getId();
        try {
            if (id == null) {
                mongoTemplate.insert(toDocument(item), collection);
                return UpsertResult.INSERTED;
            }

            Update update = new Update();
            item.getFields().forEach(update::set);
            update.set("scraped_at", item.getScrapedAt());
            update.set("source_page", item.getSourcePage());
            update.set("source_category", item.getSourceCategory());
            update.setOnInsert("first_seen_at", LocalDateTime.now());

            UpdateResult result = mongoTemplate.upsert(
                    Query.query(Criteria.where(EstateItem.ID_FIELD).is(id)), update, collection);

            return result.getUpsertedId() != null ? UpsertResult.INSERTED : UpsertResult.UPDATED;

        } catch (DuplicateKeyException e) {
            // two concurrent upserts for a new id: one inserts, the other hits the unique index
            log.error("Listing {} was inserted concurrently, skipping: {}", id, e.getMessage());
            return UpsertResult.SKIPPED_DUPLICATE;
        } catch (DataAccessException e) {
            log.error("Failed to write listing {}: {}", id, e.getMessage(), e);
            return UpsertResult.FAILED;
        }
    }

    @Override
    public void close() {
        // MongoClient lifecycle belongs to the Spring context
    }

    private Document toDocument(EstateItem item) {
        Document doc = new Document(item.getFields());
        doc.put("scraped_at", item.getScrapedAt());
        doc.put("source_page", item.getSourcePage());
        doc.put("source_category", item.getSourceCategory());
        doc.put("first_seen_at", LocalDateTime.now());
        return doc;
    }
}
