package com.anthem.iamx.fetcher;

import lombok.Value;

/**
 * Principal the credentials belong to, as reported by STS.
 */
@Value
public class CallerIdentity {

    String account;
    String arn;
    String userId;
}
