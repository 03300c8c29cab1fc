package com.park.lot.exception;

public class LotBusyException extends ParkingException {

    public LotBusyException(String plateNumber) {
        super("LOT_BUSY", plateNumber, "Parking lot is busy, please retry");
    }
}
