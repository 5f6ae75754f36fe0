package io.terraform.tfe.jsonapi;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a field to a member of the resource's {@code attributes} object. Attribute values are converted with the
 * shared Jackson mapper, so nested objects, enums and {@code java.time} types work as they do for plain JSON.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface JsonApiAttribute {

    String value();
}
