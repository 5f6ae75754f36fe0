package io.terraform.tfe;

/**
 * Implemented by options objects that contribute URL query parameters.
 */
public interface QueryOptions {

    void appendTo(QueryValues values);

    default QueryValues toQueryValues() {
        QueryValues values = new QueryValues();
        appendTo(values);
        return values;
    }
}
