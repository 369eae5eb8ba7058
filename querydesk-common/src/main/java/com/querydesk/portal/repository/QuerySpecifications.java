package com.querydesk.portal.repository;

import com.querydesk.portal.model.Query;
import com.querydesk.portal.model.QueryStatus;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/**
 * Filter building blocks for the admin query listing. A null or blank argument yields a
 * specification that matches everything.
 */
public final class QuerySpecifications {

    private QuerySpecifications() {
    }

    public static Specification<Query> hasStatus(QueryStatus status) {
        return (root, cq, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<Query> hasCategory(String category) {
        if (category == null || category.isBlank()) {
            return (root, cq, cb) -> null;
        }
        String value = category.trim().toLowerCase(Locale.ROOT);
        return (root, cq, cb) -> cb.equal(cb.lower(root.get("category")), value);
    }

    // Case-insensitive substring over message, requester name and requester email
    public static Specification<Query> containsText(String searchText) {
        if (searchText == null || searchText.isBlank()) {
            return (root, cq, cb) -> null;
        }
        String pattern = "%" + escapeLike(searchText.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, cq, cb) -> cb.or(
                cb.like(cb.lower(root.get("message")), pattern, '\\'),
                cb.like(cb.lower(root.get("requesterName")), pattern, '\\'),
                cb.like(cb.lower(root.get("requesterEmail")), pattern, '\\'));
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
