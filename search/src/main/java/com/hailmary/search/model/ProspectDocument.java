package com.hailmary.search.model;

import com.hailmary.model.SourceRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document stored in the {@code prospect} index, one per {@code "Prospect"} row.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProspectDocument {

    private String id;
    private String salutation;
    private String firstName;
    private String lastName;
    private String fullName;
    private String email;
    private String jobTitle;
    private String jobTitleLevel;
    private Integer jobTitleLevelId;
    private String department;
    private String jobTitleLink;
    private String address;
    private String city;
    private String state;
    private String country;
    private String zipCode;
    private String phone;
    private String mobilePhone;
    private String companyId;
    private String externalSource;
    private String externalId;
    private String createdAt;
    private String updatedAt;

    public static ProspectDocument fromRecord(SourceRecord record) {
        String firstName = RowValues.string(record, "firstName");
        String lastName = RowValues.string(record, "lastName");
        return ProspectDocument.builder()
                .id(record.getDocumentId())
                .salutation(RowValues.string(record, "salutation"))
                .firstName(firstName)
                .lastName(lastName)
                .fullName(fullName(firstName, lastName))
                .email(RowValues.string(record, "email"))
                .jobTitle(RowValues.string(record, "jobTitle"))
                .jobTitleLevel(RowValues.string(record, "jobTitleLevel"))
                .jobTitleLevelId(RowValues.integer(record, "jobTitleLevelId"))
                .department(RowValues.string(record, "department"))
                .jobTitleLink(RowValues.string(record, "jobTitleLink"))
                .address(RowValues.string(record, "address"))
                .city(RowValues.string(record, "city"))
                .state(RowValues.string(record, "state"))
                .country(RowValues.string(record, "country"))
                .zipCode(RowValues.string(record, "zipCode"))
                .phone(RowValues.string(record, "phone"))
                .mobilePhone(RowValues.string(record, "mobilePhone"))
                .companyId(RowValues.string(record, "companyId"))
                .externalSource(RowValues.string(record, "externalSource"))
                .externalId(RowValues.string(record, "externalId"))
                .createdAt(RowValues.string(record, "createdAt"))
                .updatedAt(RowValues.string(record, "updatedAt"))
                .build();
    }

    static String fullName(String firstName, String lastName) {
        String joined = ((firstName == null ? "" : firstName.trim()) + " "
                + (lastName == null ? "" : lastName.trim())).trim();
        return joined.isEmpty() ? null : joined;
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> map = new LinkedHashMap<>();
        RowValues.putIfNotNull(map, "id", id);
        RowValues.putIfNotNull(map, "salutation", salutation);
        RowValues.putIfNotNull(map, "firstName", firstName);
        RowValues.putIfNotNull(map, "lastName", lastName);
        RowValues.putIfNotNull(map, "fullName", fullName);
        RowValues.putIfNotNull(map, "email", email);
        RowValues.putIfNotNull(map, "jobTitle", jobTitle);
        RowValues.putIfNotNull(map, "jobTitleLevel", jobTitleLevel);
        RowValues.putIfNotNull(map, "jobTitleLevelId", jobTitleLevelId);
        RowValues.putIfNotNull(map, "department", department);
        RowValues.putIfNotNull(map, "jobTitleLink", jobTitleLink);
        RowValues.putIfNotNull(map, "address", address);
        RowValues.putIfNotNull(map, "city", city);
        RowValues.putIfNotNull(map, "state", state);
        RowValues.putIfNotNull(map, "country", country);
        RowValues.putIfNotNull(map, "zipCode", zipCode);
        RowValues.putIfNotNull(map, "phone", phone);
        RowValues.putIfNotNull(map, "mobilePhone", mobilePhone);
        RowValues.putIfNotNull(map, "companyId", companyId);
        RowValues.putIfNotNull(map, "externalSource", externalSource);
        RowValues.putIfNotNull(map, "externalId", externalId);
        RowValues.putIfNotNull(map, "createdAt", createdAt);
        RowValues.putIfNotNull(map, "updatedAt", updatedAt);
        return map;
    }
}
