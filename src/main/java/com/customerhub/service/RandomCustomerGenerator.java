package com.customerhub.service;

import com.customerhub.model.dto.CustomerCreateRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

/**
 * Generates realistic random customer data: names, emails, phone numbers and addresses.
 */
@Component
public class RandomCustomerGenerator {

    private static final String[] FIRST_NAMES = {
            "James", "Mary", "John", "Patricia", "Robert", "Jennifer", "Michael", "Linda",
            "William", "Barbara", "David", "Elizabeth", "Richard", "Susan", "Joseph", "Jessica",
            "Thomas", "Sarah", "Christopher", "Karen", "Charles", "Nancy", "Daniel", "Lisa",
            "Matthew", "Margaret", "Anthony", "Betty", "Mark", "Sandra", "Donald", "Ashley",
            "Steven", "Kimberly", "Andrew", "Emily", "Paul", "Donna", "Joshua", "Michelle",
            "Kenneth", "Carol", "Kevin", "Amanda", "Brian", "Melissa", "George", "Deborah",
            "Timothy", "Stephanie", "Ronald", "Dorothy", "Edward", "Rebecca", "Jason", "Sharon",
            "Jeffrey", "Laura", "Ryan", "Cynthia", "Jacob", "Amy"
    };

    private static final String[] LAST_NAMES = {
            "Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller", "Davis",
            "Rodriguez", "Martinez", "Hernandez", "Lopez", "Gonzalez", "Wilson", "Anderson", "Thomas",
            "Taylor", "Moore", "Jackson", "Martin", "Lee", "Perez", "Thompson", "White",
            "Harris", "Sanchez", "Clark", "Ramirez", "Lewis", "Robinson", "Walker", "Young",
            "Allen", "King", "Wright", "Scott", "Torres", "Nguyen", "Hill", "Flores",
            "Green", "Adams", "Nelson", "Baker", "Hall", "Rivera", "Campbell", "Mitchell",
            "Carter", "Roberts", "Gomez", "Phillips", "Evans", "Turner", "Diaz", "Parker",
            "Cruz", "Edwards", "Collins", "Reyes", "Stewart", "Morris", "Morales", "Murphy"
    };

    private static final String[] EMAIL_DOMAINS = {
            "gmail.com", "yahoo.com", "hotmail.com", "outlook.com", "icloud.com",
            "aol.com", "protonmail.com", "mail.com", "zoho.com", "gmx.com"
    };

    private static final String[] STREETS = {
            "Main St", "Oak Ave", "Maple Dr", "Park Blvd", "Cedar Ln",
            "Elm St", "Washington Ave", "Lake Rd", "Hill St", "Pine Ct",
            "First St", "Second Ave", "Third St", "Fourth Ave", "Fifth St",
            "Broadway", "Market St", "Church St", "Walnut St", "Chestnut St"
    };

    private static final String[] CITIES = {
            "New York", "Los Angeles", "Chicago", "Houston", "Phoenix",
            "Philadelphia", "San Antonio", "San Diego", "Dallas", "San Jose",
            "Austin", "Jacksonville", "Fort Worth", "Columbus", "Charlotte",
            "San Francisco", "Indianapolis", "Seattle", "Denver", "Boston",
            "Portland", "Nashville", "Memphis", "Detroit", "Baltimore"
    };

    private static final String[] STATES = {
            "AL", "AK", "AZ", "AR", "CA", "CO", "CT", "DE", "FL", "GA",
            "HI", "ID", "IL", "IN", "IA", "KS", "KY", "LA", "ME", "MD",
            "MA", "MI", "MN", "MS", "MO", "MT", "NE", "NV", "NH", "NJ",
            "NM", "NY", "NC", "ND", "OH", "OK", "OR", "PA", "RI", "SC",
            "SD", "TN", "TX", "UT", "VT", "VA", "WA", "WV", "WI", "WY"
    };

    private static final String[] COUNTRIES = {
            "United States", "Canada", "United Kingdom", "Australia", "Germany",
            "France", "Spain", "Italy", "Netherlands", "Sweden"
    };

    private final Random random;

    public RandomCustomerGenerator() {
        this(new Random());
    }

    RandomCustomerGenerator(Random random) {
        this.random = random;
    }

    /**
     * Generate {@code count} customers whose emails are distinct within the batch.
     * Emails may still clash with customers already stored.
     *
     * @param count Number of customers
     * @return Create requests, one per customer
     */
    public List<CustomerCreateRequest> generateCustomers(int count) {
        List<CustomerCreateRequest> customers = new ArrayList<>(count);
        Set<String> usedEmails = new HashSet<>();

        for (int i = 0; i < count; i++) {
            String firstName = pick(FIRST_NAMES);
            String lastName = pick(LAST_NAMES);
            String email = uniqueEmail(firstName, lastName, i, usedEmails);
            usedEmails.add(email);

            customers.add(CustomerCreateRequest.builder()
                    .name(firstName + " " + lastName)
                    .email(email)
                    .phone(phoneNumber())
                    .address(address())
                    .build());
        }
        return customers;
    }

    private String uniqueEmail(String firstName, String lastName, int index, Set<String> usedEmails) {
        String domain = pick(EMAIL_DOMAINS);
        String localPart = firstName.toLowerCase(Locale.ROOT) + "." + lastName.toLowerCase(Locale.ROOT);
        String email = localPart + "@" + domain;
        if (usedEmails.contains(email)) {
            return localPart + index + "@" + domain;
        }
        return email;
    }

    // +1-XXX-XXX-XXXX
    private String phoneNumber() {
        int areaCode = between(200, 999);
        int prefix = between(200, 999);
        int lineNumber = between(1000, 9999);
        return String.format(Locale.ROOT, "+1-%d-%d-%d", areaCode, prefix, lineNumber);
    }

    private String address() {
        return String.format(Locale.ROOT, "%d %s, %s, %s %d, %s",
                between(1, 9999), pick(STREETS), pick(CITIES), pick(STATES),
                between(10000, 99999), pick(COUNTRIES));
    }

    private String pick(String[] values) {
        return values[random.nextInt(values.length)];
    }

    private int between(int fromInclusive, int toExclusive) {
        return fromInclusive + random.nextInt(toExclusive - fromInclusive);
    }
}
