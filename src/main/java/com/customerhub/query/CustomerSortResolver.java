package com.customerhub.query;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Maps the requested sort key and direction to a {@link CustomerOrder}.
 *
 * <ul>
 *   <li>both blank: createdAt descending</li>
 *   <li>blank key: createdAt in the requested direction</li>
 *   <li>unknown key, including one padded with whitespace: createdAt descending, whatever the requested direction</li>
 *   <li>direction is descending only for "desc" (any case), ascending otherwise</li>
 * </ul>
 */
@Component
public class CustomerSortResolver {

    private static final String DESCENDING = "desc";

    public CustomerOrder resolve(String sortBy, String sortOrder) {
        boolean keyBlank = !StringUtils.hasText(sortBy);
        boolean orderBlank = !StringUtils.hasText(sortOrder);

        boolean descending = (!orderBlank && DESCENDING.equalsIgnoreCase(sortOrder))
                || (keyBlank && orderBlank);
        Sort.Direction direction = descending ? Sort.Direction.DESC : Sort.Direction.ASC;

        if (keyBlank) {
            return new CustomerOrder(CustomerSortField.CREATED_AT, direction);
        }
        return CustomerSortField.fromKey(sortBy)
                .map(field -> new CustomerOrder(field, direction))
                .orElse(CustomerOrder.DEFAULT);
    }
}
