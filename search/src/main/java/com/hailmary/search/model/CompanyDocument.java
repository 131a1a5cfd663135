package com.hailmary.search.model;

import com.hailmary.model.SourceRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document stored in the {@code company} index, one per {@code "Company"} row.
 *
 * <p>Field names keep the table's camel-case column names so queries written against
 * the table read the same against the index.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompanyDocument {

    private String id;
    private String domain;
    private String name;
    private String industry;
    private Integer minEmployeeSize;
    private Integer maxEmployeeSize;
    private String employeeSizeLink;
    private Double revenue;
    private String address;
    private String city;
    private String state;
    private String country;
    private String zipCode;
    private String phone;
    private String mobilePhone;
    private String externalSource;
    private String externalId;
    private String createdAt;
    private String updatedAt;

    public static CompanyDocument fromRecord(SourceRecord record) {
        return CompanyDocument.builder()
                .id(record.getDocumentId())
                .domain(RowValues.string(record, "domain"))
                .name(RowValues.string(record, "name"))
                .industry(RowValues.string(record, "industry"))
                .minEmployeeSize(RowValues.integer(record, "minEmployeeSize"))
                .maxEmployeeSize(RowValues.integer(record, "maxEmployeeSize"))
                .employeeSizeLink(RowValues.string(record, "employeeSizeLink"))
                .revenue(RowValues.decimal(record, "revenue"))
                .address(RowValues.string(record, "address"))
                .city(RowValues.string(record, "city"))
                .state(RowValues.string(record, "state"))
                .country(RowValues.string(record, "country"))
                .zipCode(RowValues.string(record, "zipCode"))
                .phone(RowValues.string(record, "phone"))
                .mobilePhone(RowValues.string(record, "mobilePhone"))
                .externalSource(RowValues.string(record, "externalSource"))
                .externalId(RowValues.string(record, "externalId"))
                .createdAt(RowValues.string(record, "createdAt"))
                .updatedAt(RowValues.string(record, "updatedAt"))
                .build();
    }

    /**
     * Index payload; {@code null} fields are left out.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> map = new LinkedHashMap<>();
        RowValues.putIfNotNull(map, "id", id);
        RowValues.putIfNotNull(map, "domain", domain);
        RowValues.putIfNotNull(map, "name", name);
        RowValues.putIfNotNull(map, "industry", industry);
        RowValues.putIfNotNull(map, "minEmployeeSize", minEmployeeSize);
        RowValues.putIfNotNull(map, "maxEmployeeSize", maxEmployeeSize);
        RowValues.putIfNotNull(map, "employeeSizeLink", employeeSizeLink);
        RowValues.putIfNotNull(map, "revenue", revenue);
        RowValues.putIfNotNull(map, "address", address);
        RowValues.putIfNotNull(map, "city", city);
        RowValues.putIfNotNull(map, "state", state);
        RowValues.putIfNotNull(map, "country", country);
        RowValues.putIfNotNull(map, "zipCode", zipCode);
        RowValues.putIfNotNull(map, "phone", phone);
        RowValues.putIfNotNull(map, "mobilePhone", mobilePhone);
        RowValues.putIfNotNull(map, "externalSource", externalSource);
        RowValues.putIfNotNull(map, "externalId", externalId);
        RowValues.putIfNotNull(map, "createdAt", createdAt);
        RowValues.putIfNotNull(map, "updatedAt", updatedAt);
        return map;
    }
}
