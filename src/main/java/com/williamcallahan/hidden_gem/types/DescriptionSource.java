package com.williamcallahan.hidden_gem.types;

/**
 * Origin of a stored game description
 * - ADMIN descriptions are permanent until an admin deletes them
 * - PROVIDER descriptions may be cleared by maintenance and fetched again
 */
public enum DescriptionSource {
    ADMIN,
    PROVIDER
}
