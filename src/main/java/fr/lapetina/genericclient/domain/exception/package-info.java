/**
 * Client exceptions and the registry mapping error payload tags to domain exceptions.
 */
package fr.lapetina.genericclient.domain.exception;
