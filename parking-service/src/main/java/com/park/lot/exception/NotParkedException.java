package com.park.lot.exception;

public class NotParkedException extends ParkingException {

    public NotParkedException(String plateNumber) {
        super("NOT_PARKED", plateNumber, "No parking record found for vehicle " + plateNumber);
    }
}
