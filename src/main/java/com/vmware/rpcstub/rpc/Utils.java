/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package com.vmware.rpcstub.rpc;

public class Utils {
    public static final long MAX_UINT32 = 0xFFFFFFFFL;

    /// Write the low 32 bits of l into b[offset..offset+4) in network byte order
    public static void uintToBytes(final long l, final byte[] b, final int offset) {
        if (l < 0 || l > MAX_UINT32) {
            throw new IllegalArgumentException("Value does not fit in an unsigned 32-bit field: " + l);
        }
        for (int i = 0; i < Integer.BYTES; i++) {
            b[offset + i] = (byte) ((l >>> (Byte.SIZE * (Integer.BYTES - 1 - i))) & 0xFF);
        }
    }

    /// Read an unsigned 32-bit value stored in network byte order
    public static long bytesToUint(final byte[] b, final int offset) {
        long result = 0;
        for (int i = 0; i < Integer.BYTES; i++) {
            result <<= Byte.SIZE;
            result |= (b[offset + i] & 0xFF);
        }
        return result;
    }
}
