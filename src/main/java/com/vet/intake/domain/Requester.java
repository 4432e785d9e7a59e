package com.vet.intake.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
/**
 * The person submitting the request.
 *
 * <p>{@code mailingAddress} is only kept when it differs from {@code physicalAddress}.
 * {@code suppliedNewAddress} is only meaningful for existing account holders: it is
 * true when they entered a new address for this visit instead of the one on file.
 */
public record Requester(
        AccountStatus accountStatus,
        boolean authenticated,
        String email,
        FullName fullName,
        String phone,
        Boolean canWeText,
        PostalAddress physicalAddress,
        PostalAddress mailingAddress,
        boolean suppliedNewAddress
) {

    public Requester {
        if (accountStatus == null) throw new IllegalArgumentException("accountStatus is required");
        if (authenticated && accountStatus == AccountStatus.NEW) {
            throw new IllegalArgumentException("a new requester cannot be authenticated");
        }
        if (fullName == null) fullName = FullName.of("", "");
        if (mailingAddress != null && mailingAddress.equals(physicalAddress)) {
            mailingAddress = null;
        }
        if (accountStatus == AccountStatus.NEW) {
            suppliedNewAddress = false;
        }
    }

    @JsonIgnore
    public boolean isExisting() {
        return accountStatus == AccountStatus.EXISTING;
    }

    /** Existing holder who did not enter a new address; that address was validated at onboarding. */
    public boolean keepsAddressOnFile() {
        return isExisting() && !suppliedNewAddress;
    }

    public Requester withPhysicalAddress(PostalAddress address) {
        return new Requester(accountStatus, authenticated, email, fullName, phone, canWeText,
                address, mailingAddress, suppliedNewAddress);
    }
}
