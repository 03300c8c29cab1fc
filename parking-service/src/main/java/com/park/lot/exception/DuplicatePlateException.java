package com.park.lot.exception;

public class DuplicatePlateException extends ParkingException {

    public DuplicatePlateException(String plateNumber) {
        super("DUPLICATE_PLATE", plateNumber, "Plate " + plateNumber + " is already on the package whitelist");
    }
}
