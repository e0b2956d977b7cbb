package com.voterimport.voterimport.ingest;

/**
 * A normalized voter record in the common schema.
 * <p>
 * {@code null} means the field is not mapped for the state; an empty string means it is mapped but blank.
 * {@code address} is the composed street line (number, fraction, street name, unit).
 */
public record CanonicalRecord(
        String voterId,
        String firstName,
        String middleName,
        String lastName,
        String suffix,
        String streetNumber,
        String streetFraction,
        String streetName,
        String unit,
        String address,
        String city,
        String state,
        String zip,
        String county,
        String precinct,
        String party,
        String gender,
        String statusCode,
        String legislativeDistrict,
        String congressionalDistrict,
        String birthDate,
        String registrationDate,
        String lastVotedDate,
        String mailingAddress,
        String mailingAddress2,
        String mailingAddress3,
        String mailingCity,
        String mailingState,
        String mailingZip,
        String mailingCountry,
        String stateCode,
        String sourceRowRef
) {
}
