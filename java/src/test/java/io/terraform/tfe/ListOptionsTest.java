package io.terraform.tfe;

import io.terraform.tfe.run.RunListOptions;
import io.terraform.tfe.run.RunStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ListOptionsTest {

    @Test
    void pagingSettersKeepTheConcreteType() {
        RunListOptions options = new RunListOptions().pageNumber(3).pageSize(20).status(RunStatus.PLANNED);

        QueryValues values = new QueryValues();
        options.appendTo(values);

        assertEquals(3, options.getPageNumber());
        assertEquals(20, options.getPageSize());
        assertEquals(List.of("3"), values.asMap().get("page[number]"));
        assertEquals(List.of("20"), values.asMap().get("page[size]"));
        assertTrue(values.asMap().containsKey("filter[status]"));
    }

    @Test
    void zeroPagingIsLeftToTheServer() {
        QueryValues values = new QueryValues();
        new PageOptions().appendTo(values);

        assertTrue(values.isEmpty());
        assertEquals(Map.of("page[number]", List.of("1"), "page[size]", List.of("5")), collect(PageOptions.page(1, 5)));
    }

    private static Map<String, List<String>> collect(QueryOptions options) {
        QueryValues values = new QueryValues();
        options.appendTo(values);
        return values.asMap();
    }
}
