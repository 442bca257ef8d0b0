/**
 * The primary server state machine and its status and control companions.
 */
package fr.lapetina.primaryserver.server;
