package com.e2eq.links.annotations;

import com.e2eq.links.core.LinkType;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field (or getter) holding the id, or a collection of ids, of another entity. Saving the
 * owning entity keeps one link of the given type per referenced id, with the owner as the source.
 * Clearing the field removes the link.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD})
public @interface LinkedBy {

    LinkType value();
}
