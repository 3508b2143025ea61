package com.gentoro.fedquery.source.document;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Validated document-store request.
 *
 * @param collection target collection, already checked against the allowed name pattern
 * @param operation one of {@code find}, {@code aggregate}, {@code count}
 * @param filter match document for find and count
 * @param pipeline aggregation stages, empty unless {@code operation} is aggregate
 * @param projection optional projection for find
 * @param sort optional sort specification for find
 * @param skip number of documents to skip, 0 when absent
 * @param limit maximum number of documents for find, 0 meaning unbounded
 */
public record DocumentQuery(
    String collection,
    String operation,
    ObjectNode filter,
    List<ObjectNode> pipeline,
    ObjectNode projection,
    ObjectNode sort,
    int skip,
    int limit) {}
