/**
 * Domain services of the organization service.
 *
 * <p>Classes here depend on the platform libraries and the storage ports only, never on the
 * {@code api} or {@code infrastructure} packages or on Spring.
 */
package com.brayford.organization.domain;
