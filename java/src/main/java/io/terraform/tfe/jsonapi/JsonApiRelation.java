package io.terraform.tfe.jsonapi;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a field to a member of the resource's {@code relationships} object. The field type must be a
 * {@link JsonApiResource} class (to-one) or a {@code List} of one (to-many).
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface JsonApiRelation {

    String value();
}
