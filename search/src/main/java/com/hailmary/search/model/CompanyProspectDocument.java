package com.hailmary.search.model;

import com.hailmary.model.SourceRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document stored in the {@code company_prospect_view} index: one prospect joined with
 * its company, identified by {@code company_id:prospect_id}.  A company without prospects
 * still has a row, with no {@code prospect_id}.
 *
 * <p>The view prefixes columns that exist on both tables ({@code prospect_city},
 * {@code company_city}, ...).  Those are kept as-is, since search clients filter on them,
 * and a merged field without prefix carries the prospect's value, falling back to the
 * company's.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompanyProspectDocument {

    private String prospectId;
    private String companyId;
    private String companyName;
    private String domain;
    private String industry;
    private Double revenue;
    private Integer minEmployeeSize;
    private Integer maxEmployeeSize;

    private String salutation;
    private String firstName;
    private String lastName;
    private String fullName;
    private String email;
    private String jobTitle;
    private String jobTitleLevel;
    private String department;

    private String prospectCity;
    private String companyCity;
    private String prospectState;
    private String companyState;
    private String prospectCountry;
    private String companyCountry;
    private String prospectPhone;
    private String companyPhone;
    private String prospectZipCode;
    private String companyZipCode;

    private String lastUpdated;

    public static CompanyProspectDocument fromRecord(SourceRecord record) {
        String firstName = RowValues.string(record, "firstName");
        String lastName = RowValues.string(record, "lastName");
        return CompanyProspectDocument.builder()
                .prospectId(RowValues.string(record, "prospect_id"))
                .companyId(RowValues.string(record, "company_id"))
                .companyName(RowValues.string(record, "company_name"))
                .domain(RowValues.string(record, "domain"))
                .industry(RowValues.string(record, "industry"))
                .revenue(RowValues.decimal(record, "revenue"))
                .minEmployeeSize(RowValues.integer(record, "minEmployeeSize"))
                .maxEmployeeSize(RowValues.integer(record, "maxEmployeeSize"))
                .salutation(RowValues.string(record, "salutation"))
                .firstName(firstName)
                .lastName(lastName)
                .fullName(ProspectDocument.fullName(firstName, lastName))
                .email(RowValues.string(record, "email"))
                .jobTitle(RowValues.string(record, "jobTitle"))
                .jobTitleLevel(RowValues.string(record, "jobTitleLevel"))
                .department(RowValues.string(record, "department"))
                .prospectCity(RowValues.string(record, "prospect_city"))
                .companyCity(RowValues.string(record, "company_city"))
                .prospectState(RowValues.string(record, "prospect_state"))
                .companyState(RowValues.string(record, "company_state"))
                .prospectCountry(RowValues.string(record, "prospect_country"))
                .companyCountry(RowValues.string(record, "company_country"))
                .prospectPhone(RowValues.string(record, "prospect_phone"))
                .companyPhone(RowValues.string(record, "company_phone"))
                .prospectZipCode(RowValues.string(record, "prospect_zipcode"))
                .companyZipCode(RowValues.string(record, "company_zipcode"))
                .lastUpdated(RowValues.string(record, "last_updated"))
                .build();
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> map = new LinkedHashMap<>();
        RowValues.putIfNotNull(map, "prospect_id", prospectId);
        RowValues.putIfNotNull(map, "company_id", companyId);
        RowValues.putIfNotNull(map, "company_name", companyName);
        RowValues.putIfNotNull(map, "domain", domain);
        RowValues.putIfNotNull(map, "industry", industry);
        RowValues.putIfNotNull(map, "revenue", revenue);
        RowValues.putIfNotNull(map, "minEmployeeSize", minEmployeeSize);
        RowValues.putIfNotNull(map, "maxEmployeeSize", maxEmployeeSize);
        RowValues.putIfNotNull(map, "salutation", salutation);
        RowValues.putIfNotNull(map, "firstName", firstName);
        RowValues.putIfNotNull(map, "lastName", lastName);
        RowValues.putIfNotNull(map, "fullName", fullName);
        RowValues.putIfNotNull(map, "email", email);
        RowValues.putIfNotNull(map, "jobTitle", jobTitle);
        RowValues.putIfNotNull(map, "jobTitleLevel", jobTitleLevel);
        RowValues.putIfNotNull(map, "department", department);

        RowValues.putIfNotNull(map, "prospect_city", prospectCity);
        RowValues.putIfNotNull(map, "company_city", companyCity);
        RowValues.putIfNotNull(map, "prospect_state", prospectState);
        RowValues.putIfNotNull(map, "company_state", companyState);
        RowValues.putIfNotNull(map, "prospect_country", prospectCountry);
        RowValues.putIfNotNull(map, "company_country", companyCountry);
        RowValues.putIfNotNull(map, "prospect_phone", prospectPhone);
        RowValues.putIfNotNull(map, "company_phone", companyPhone);
        RowValues.putIfNotNull(map, "prospect_zipcode", prospectZipCode);
        RowValues.putIfNotNull(map, "company_zipcode", companyZipCode);

        RowValues.putIfNotNull(map, "city", RowValues.firstNonBlank(prospectCity, companyCity));
        RowValues.putIfNotNull(map, "state", RowValues.firstNonBlank(prospectState, companyState));
        RowValues.putIfNotNull(map, "country", RowValues.firstNonBlank(prospectCountry, companyCountry));
        RowValues.putIfNotNull(map, "phone", RowValues.firstNonBlank(prospectPhone, companyPhone));
        RowValues.putIfNotNull(map, "zipCode", RowValues.firstNonBlank(prospectZipCode, companyZipCode));

        RowValues.putIfNotNull(map, "last_updated", lastUpdated);
        return map;
    }
}
