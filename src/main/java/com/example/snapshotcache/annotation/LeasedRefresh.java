package com.example.snapshotcache.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs the annotated refresh only while holding the refresh lease of its
 * {@link com.example.snapshotcache.model.ResourceType} argument. When another refresh
 * of the same type holds the lease the method is not invoked and
 * {@code RefreshOutcome.alreadyInProgress(type)} is returned instead, so the method
 * must return {@link com.example.snapshotcache.model.RefreshOutcome}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LeasedRefresh {
}
