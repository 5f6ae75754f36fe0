package io.terraform.tfe.stack;

public enum StackSortColumn {
    NAME("name"),
    NAME_DESC("-name"),
    UPDATED_AT("updated-at"),
    UPDATED_AT_DESC("-updated-at");

    private final String value;

    StackSortColumn(String value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return value;
    }
}
