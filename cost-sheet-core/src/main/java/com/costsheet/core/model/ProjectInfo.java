package com.costsheet.core.model;

import java.time.LocalDate;

/**
 * Project metadata shown on every sheet and in the quotation.
 *
 * @param name project name
 * @param number project (job) number
 * @param customer customer contact name
 * @param company customer company
 * @param address customer address
 * @param location site location
 * @param deliveryLocation delivery location
 * @param estimator estimator name(s), {@code "A Person / B Person"} for several
 * @param salesContact sales contact name
 * @param date project date
 * @param revision revision letter, empty before the first revision
 */
public record ProjectInfo(
    String name,
    String number,
    String customer,
    String company,
    String address,
    String location,
    String deliveryLocation,
    String estimator,
    String salesContact,
    LocalDate date,
    String revision
) {
    public ProjectInfo {
        if (revision == null) {
            revision = "";
        }
    }

    public ProjectInfo withRevision(String newRevision) {
        return new ProjectInfo(name, number, customer, company, address, location,
            deliveryLocation, estimator, salesContact, date, newRevision);
    }
}
