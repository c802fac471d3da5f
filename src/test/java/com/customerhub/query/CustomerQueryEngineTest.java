package com.customerhub.query;

import com.customerhub.exception.InvalidRequestException;
import com.customerhub.model.entity.Customer;
import com.customerhub.store.InMemoryCustomerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.customerhub.support.CustomerFixtures.BASE_TIME;
import static com.customerhub.support.CustomerFixtures.customer;
import static com.customerhub.support.CustomerFixtures.deletedCustomer;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for CustomerQueryEngine against the in-memory store.
 */
class CustomerQueryEngineTest {

    private InMemoryCustomerStore store;
    private CustomerQueryEngine queryEngine;

    @BeforeEach
    void setUp() {
        store = new InMemoryCustomerStore();
        queryEngine = new CustomerQueryEngine(store, new CustomerFilterPipeline(), new CustomerSortResolver(), 100);
    }

    @Test
    void list_SearchTerm_CountsAllMatchesBeforePaging() {
        List<Customer> customers = new ArrayList<>();
        customers.add(customer("John Smith", "john@x.com", BASE_TIME.plusMinutes(1)));
        customers.add(customer("Maria Lopez", "m.SMITH@x.com", BASE_TIME.plusMinutes(2)));
        customers.add(customer("Peter Smithson", "peter@x.com", BASE_TIME.plusMinutes(3)));
        for (int i = 0; i < 12; i++) {
            customers.add(customer("Customer " + i, "customer" + i + "@x.com", BASE_TIME.plusMinutes(10 + i)));
        }
        seed(customers);

        StepVerifier.create(queryEngine.list(query(0, 10).searchTerm("smith").build()))
                .assertNext(page -> {
                    assertThat(page.getTotalCount()).isEqualTo(3);
                    assertThat(page.getItems()).hasSize(3);
                    assertThat(page.getItems()).extracting(Customer::getName)
                            .containsExactly("Peter Smithson", "Maria Lopez", "John Smith");
                })
                .verifyComplete();
    }

    @Test
    void list_TotalCount_IsIndependentOfWindow() {
        List<Customer> customers = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            customers.add(customer("Active " + i, "active" + i + "@x.com", BASE_TIME.plusMinutes(i)));
        }
        customers.add(deletedCustomer("Gone 1", "gone1@x.com", BASE_TIME));
        customers.add(deletedCustomer("Gone 2", "gone2@x.com", BASE_TIME));
        seed(customers);

        StepVerifier.create(queryEngine.list(query(0, 5).build()))
                .assertNext(page -> {
                    assertThat(page.getTotalCount()).isEqualTo(12);
                    assertThat(page.getItems()).hasSize(5);
                })
                .verifyComplete();

        StepVerifier.create(queryEngine.list(query(10, 5).build()))
                .assertNext(page -> {
                    assertThat(page.getTotalCount()).isEqualTo(12);
                    assertThat(page.getItems()).hasSize(2);
                })
                .verifyComplete();

        StepVerifier.create(queryEngine.list(query(40, 5).build()))
                .assertNext(page -> {
                    assertThat(page.getTotalCount()).isEqualTo(12);
                    assertThat(page.getItems()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void list_DeletedCustomers_NeverReturned() {
        seed(List.of(
                customer("John Smith", "john@x.com"),
                deletedCustomer("John Smith", "old.john@x.com", BASE_TIME)));

        StepVerifier.create(queryEngine.list(query(0, 10).searchTerm("john").build()))
                .assertNext(page -> {
                    assertThat(page.getTotalCount()).isEqualTo(1);
                    assertThat(page.getItems()).allMatch(c -> !c.isDeleted());
                })
                .verifyComplete();

        StepVerifier.create(queryEngine.list(query(0, 10).emailFilter("old.john@x.com").build()))
                .assertNext(page -> assertThat(page.getTotalCount()).isZero())
                .verifyComplete();
    }

    @Test
    void list_NoSortParameters_OrdersByCreatedAtDescending() {
        seed(List.of(
                customer("First", "first@x.com", BASE_TIME),
                customer("Second", "second@x.com", BASE_TIME.plusHours(1)),
                customer("Third", "third@x.com", BASE_TIME.plusHours(2))));

        StepVerifier.create(queryEngine.list(query(0, 10).build()))
                .assertNext(page -> assertThat(page.getItems()).extracting(Customer::getName)
                        .containsExactly("Third", "Second", "First"))
                .verifyComplete();
    }

    @Test
    void list_UnknownSortKey_FallsBackToCreatedAtDescending() {
        seed(List.of(
                customer("Bravo", "b@x.com", BASE_TIME),
                customer("Alpha", "a@x.com", BASE_TIME.plusHours(1)),
                customer("Charlie", "c@x.com", BASE_TIME.plusHours(2))));

        StepVerifier.create(queryEngine.list(query(0, 10).sortBy("phone").sortOrder("asc").build()))
                .assertNext(page -> assertThat(page.getItems()).extracting(Customer::getName)
                        .containsExactly("Charlie", "Alpha", "Bravo"))
                .verifyComplete();
    }

    @Test
    void list_SortByName_HonoursDirection() {
        seed(List.of(
                customer("Bravo", "b@x.com", BASE_TIME),
                customer("Alpha", "a@x.com", BASE_TIME.plusHours(1)),
                customer("Charlie", "c@x.com", BASE_TIME.plusHours(2))));

        StepVerifier.create(queryEngine.list(query(0, 10).sortBy("name").build()))
                .assertNext(page -> assertThat(page.getItems()).extracting(Customer::getName)
                        .containsExactly("Alpha", "Bravo", "Charlie"))
                .verifyComplete();

        StepVerifier.create(queryEngine.list(query(0, 10).sortBy("Name").sortOrder("DESC").build()))
                .assertNext(page -> assertThat(page.getItems()).extracting(Customer::getName)
                        .containsExactly("Charlie", "Bravo", "Alpha"))
                .verifyComplete();
    }

    @Test
    void list_SortByName_OrdersUpperCaseBeforeLowerCase() {
        seed(List.of(
                customer("alice", "alice@x.com", BASE_TIME),
                customer("Bob", "bob@x.com", BASE_TIME.plusMinutes(1)),
                customer("Carol", "carol@x.com", BASE_TIME.plusMinutes(2))));

        StepVerifier.create(queryEngine.list(query(0, 10).sortBy("name").sortOrder("asc").build()))
                .assertNext(page -> assertThat(page.getItems()).extracting(Customer::getName)
                        .containsExactly("Bob", "Carol", "alice"))
                .verifyComplete();
    }

    @Test
    void list_PaddedSortKey_FallsBackToCreatedAtDescending() {
        seed(List.of(
                customer("Zed", "zed@x.com", BASE_TIME),
                customer("Amy", "amy@x.com", BASE_TIME.plusMinutes(1))));

        StepVerifier.create(queryEngine.list(query(0, 10).sortBy(" name ").sortOrder("asc").build()))
                .assertNext(page -> assertThat(page.getItems()).extracting(Customer::getName)
                        .containsExactly("Amy", "Zed"))
                .verifyComplete();
    }

    @Test
    void list_EqualSortKeys_BreakTiesById() {
        List<Customer> twins = List.of(
                customer("Same", "one@x.com", BASE_TIME),
                customer("Same", "two@x.com", BASE_TIME),
                customer("Same", "three@x.com", BASE_TIME));
        seed(twins);
        List<UUID> idsAscending = twins.stream()
                .map(Customer::getId)
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.toList());

        StepVerifier.create(queryEngine.list(query(0, 10).sortBy("name").sortOrder("desc").build()))
                .assertNext(page -> assertThat(page.getItems()).extracting(Customer::getId)
                        .containsExactlyElementsOf(idsAscending))
                .verifyComplete();

        StepVerifier.create(queryEngine.list(query(0, 10).build()))
                .assertNext(page -> assertThat(page.getItems()).extracting(Customer::getId)
                        .containsExactlyElementsOf(idsAscending))
                .verifyComplete();
    }

    @Test
    void list_DateRange_IsInclusive() {
        seed(List.of(
                customer("Before", "before@x.com", BASE_TIME.minusSeconds(1)),
                customer("Start", "start@x.com", BASE_TIME),
                customer("End", "end@x.com", BASE_TIME.plusDays(1)),
                customer("After", "after@x.com", BASE_TIME.plusDays(1).plusSeconds(1))));

        StepVerifier.create(queryEngine.list(query(0, 10)
                        .dateFrom(BASE_TIME)
                        .dateTo(BASE_TIME.plusDays(1))
                        .sortBy("createdAt")
                        .sortOrder("asc")
                        .build()))
                .assertNext(page -> assertThat(page.getItems()).extracting(Customer::getName)
                        .containsExactly("Start", "End"))
                .verifyComplete();
    }

    @Test
    void list_NegativeSkip_IsTreatedAsZero() {
        seed(List.of(customer("Only", "only@x.com")));

        StepVerifier.create(queryEngine.list(query(-5, 10).build()))
                .assertNext(page -> assertThat(page.getItems()).hasSize(1))
                .verifyComplete();
    }

    @Test
    void list_NonPositiveTake_IsRejected() {
        StepVerifier.create(queryEngine.list(query(0, 0).build()))
                .expectError(InvalidRequestException.class)
                .verify();

        StepVerifier.create(queryEngine.list(query(0, -1).build()))
                .expectError(InvalidRequestException.class)
                .verify();
    }

    @Test
    void list_TakeAboveMaximum_IsRejected() {
        StepVerifier.create(queryEngine.list(query(0, 101).build()))
                .expectErrorMatches(error -> error instanceof InvalidRequestException
                        && error.getMessage().contains("100"))
                .verify();
    }

    private CustomerListQuery.CustomerListQueryBuilder query(long skip, int take) {
        return CustomerListQuery.builder().skip(skip).take(take);
    }

    private void seed(List<Customer> customers) {
        customers.forEach(customer -> store.insert(customer).block());
    }
}
